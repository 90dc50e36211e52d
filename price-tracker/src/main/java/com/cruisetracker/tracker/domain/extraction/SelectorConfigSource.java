package com.cruisetracker.tracker.domain.extraction;

/**
 * Supplies the selector configuration for the next run. Implementations keep serving the last
 * good configuration when the source becomes unreadable and throw
 * {@link com.cruisetracker.tracker.domain.exceptions.SelectorConfigException} only when none was ever loaded.
 */
public interface SelectorConfigSource {

    SelectorConfig current();
}
