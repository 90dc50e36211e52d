package com.cruisetracker.tracker.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter runsCompletedCounter(MeterRegistry registry) {
        return Counter.builder("tracker.runs.completed")
                .description("Scrape runs that ran to completion")
                .register(registry);
    }

    @Bean
    public Counter snapshotsStoredCounter(MeterRegistry registry) {
        return Counter.builder("tracker.snapshots.stored")
                .description("New price snapshots appended")
                .register(registry);
    }

    @Bean
    public Counter snapshotsDeduplicatedCounter(MeterRegistry registry) {
        return Counter.builder("tracker.snapshots.deduplicated")
                .description("Candidates dropped as repeats within their run window")
                .register(registry);
    }

    @Bean
    public Counter fetchFailedCounter(MeterRegistry registry) {
        return Counter.builder("tracker.fetch.failed")
                .description("Itineraries whose fetch failed, transient or permanent")
                .register(registry);
    }

    @Bean
    public Counter extractionFailedCounter(MeterRegistry registry) {
        return Counter.builder("tracker.extraction.failed")
                .description("Fetched pages no extraction strategy could read")
                .register(registry);
    }

    @Bean
    public Counter dealsDetectedCounter(MeterRegistry registry) {
        return Counter.builder("tracker.deals.detected")
                .description("Deal events created")
                .register(registry);
    }

    @Bean
    public Counter notificationsSentCounter(MeterRegistry registry) {
        return Counter.builder("tracker.notifications.sent")
                .description("Deal alerts delivered")
                .register(registry);
    }

    @Bean
    public Counter notificationsSuppressedCounter(MeterRegistry registry) {
        return Counter.builder("tracker.notifications.suppressed")
                .description("Deal alerts suppressed inside an active dedup window")
                .register(registry);
    }

    @Bean
    public Counter notificationsFailedCounter(MeterRegistry registry) {
        return Counter.builder("tracker.notifications.failed")
                .description("Deal alerts that exhausted delivery retries")
                .register(registry);
    }
}
