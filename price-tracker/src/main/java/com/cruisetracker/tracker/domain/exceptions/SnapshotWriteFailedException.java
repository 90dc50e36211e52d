package com.cruisetracker.tracker.domain.exceptions;

public class SnapshotWriteFailedException extends RuntimeException {

    private SnapshotWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public static SnapshotWriteFailedException of(String entity, String id, Throwable cause) {
        return new SnapshotWriteFailedException("Failed to write " + entity + " " + id, cause);
    }
}
