package com.cruisetracker.tracker.domain.exceptions;

public class TransientFetchException extends RuntimeException {

    private final int httpStatus;

    private TransientFetchException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public static TransientFetchException httpStatus(int status) {
        return new TransientFetchException("Upstream returned retryable status " + status, status);
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
