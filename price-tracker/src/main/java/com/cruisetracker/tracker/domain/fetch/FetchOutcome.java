package com.cruisetracker.tracker.domain.fetch;

/**
 * Either a usable capture or a classified error. The capture is present in both cases.
 */
public record FetchOutcome(RawCapture capture, FetchError error) {

    public static FetchOutcome success(RawCapture capture) {
        return new FetchOutcome(capture, null);
    }

    public static FetchOutcome failure(RawCapture capture, FetchError error) {
        return new FetchOutcome(capture, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
