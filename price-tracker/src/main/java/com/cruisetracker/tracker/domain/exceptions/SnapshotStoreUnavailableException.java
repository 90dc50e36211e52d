package com.cruisetracker.tracker.domain.exceptions;

public class SnapshotStoreUnavailableException extends RuntimeException {

    private SnapshotStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static SnapshotStoreUnavailableException of(Throwable cause) {
        return new SnapshotStoreUnavailableException("Snapshot store is unreachable", cause);
    }
}
