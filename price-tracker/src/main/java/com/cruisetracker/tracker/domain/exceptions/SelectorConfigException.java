package com.cruisetracker.tracker.domain.exceptions;

public class SelectorConfigException extends RuntimeException {

    private SelectorConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    public static SelectorConfigException unreadable(String location, Throwable cause) {
        return new SelectorConfigException("Selector configuration unreadable: " + location, cause);
    }

    public static SelectorConfigException invalid(String location, String reason) {
        return new SelectorConfigException("Selector configuration invalid at " + location + ": " + reason, null);
    }
}
