package com.cruisetracker.tracker.domain.fetch;

import com.cruisetracker.common.retry.RetryPolicy;
import java.time.Duration;

public record FetchPolicy(int maxInFlight, Duration minIntervalPerHost, RetryPolicy retry) {
}
