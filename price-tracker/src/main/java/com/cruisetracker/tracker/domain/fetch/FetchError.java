package com.cruisetracker.tracker.domain.fetch;

public record FetchError(FetchErrorKind kind, String message, int httpStatus) {

    public static FetchError transientFailure(String message, int httpStatus) {
        return new FetchError(FetchErrorKind.TRANSIENT, message, httpStatus);
    }

    public static FetchError permanentFailure(String message, int httpStatus) {
        return new FetchError(FetchErrorKind.PERMANENT, message, httpStatus);
    }
}
