package com.cruisetracker.tracker.domain.fetch;

import com.cruisetracker.common.retry.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Enforces a minimum interval between requests to the same host. Each caller reserves the
 * next free slot for its host atomically, then sleeps until that slot arrives.
 */
public class HostRateLimiter {

    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ConcurrentMap<String, Instant> nextSlots = new ConcurrentHashMap<>();

    public HostRateLimiter(Duration minInterval, Clock clock, Sleeper sleeper) {
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void acquire(String host) throws InterruptedException {
        var reserved = new Instant[1];
        nextSlots.compute(host, (h, next) -> {
            var now = clock.instant();
            reserved[0] = next == null || next.isBefore(now) ? now : next;
            return reserved[0].plus(minInterval);
        });
        var wait = Duration.between(clock.instant(), reserved[0]);
        if (!wait.isNegative() && !wait.isZero()) {
            sleeper.sleep(wait);
        }
    }
}
