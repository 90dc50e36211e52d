package com.cruisetracker.tracker.domain.exceptions;

public class PermanentFetchException extends RuntimeException {

    private final int httpStatus;

    private PermanentFetchException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public static PermanentFetchException httpStatus(int status) {
        return new PermanentFetchException("Upstream returned non-retryable status " + status, status);
    }

    public static PermanentFetchException emptyBody(int status) {
        return new PermanentFetchException("Upstream returned an empty body with status " + status, status);
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
