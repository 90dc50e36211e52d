package com.cruisetracker.tracker.domain.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import com.cruisetracker.tracker.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class HostRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:15:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();
    private final HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(2), clock, sleeps::add);

    @Test
    void shouldLetFirstRequestThroughImmediately() throws InterruptedException {
        // when
        limiter.acquire("www.example.com");

        // then
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldSpaceBackToBackRequestsToSameHost() throws InterruptedException {
        // when
        limiter.acquire("www.example.com");
        limiter.acquire("www.example.com");
        limiter.acquire("www.example.com");

        // then
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void shouldNotDelayOtherHosts() throws InterruptedException {
        // when
        limiter.acquire("www.example.com");
        limiter.acquire("images.example.com");

        // then
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldNotDelayOnceIntervalHasElapsed() throws InterruptedException {
        // given
        limiter.acquire("www.example.com");
        clock.advance(Duration.ofSeconds(3));

        // when
        limiter.acquire("www.example.com");

        // then
        assertThat(sleeps).isEmpty();
    }
}
