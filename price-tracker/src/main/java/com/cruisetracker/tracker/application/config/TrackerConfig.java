package com.cruisetracker.tracker.application.config;

import com.cruisetracker.common.retry.RetryExecutor;
import com.cruisetracker.common.retry.Sleeper;
import com.cruisetracker.tracker.domain.deal.DealDetector;
import com.cruisetracker.tracker.domain.deal.DealEventRepository;
import com.cruisetracker.tracker.domain.deal.DealThresholds;
import com.cruisetracker.tracker.domain.extraction.CandidateValidator;
import com.cruisetracker.tracker.domain.extraction.SelectorConfigSource;
import com.cruisetracker.tracker.domain.extraction.StrategyChainFactory;
import com.cruisetracker.tracker.domain.fetch.FetchPolicy;
import com.cruisetracker.tracker.domain.fetch.Fetcher;
import com.cruisetracker.tracker.domain.fetch.HostRateLimiter;
import com.cruisetracker.tracker.domain.fetch.PageClient;
import com.cruisetracker.tracker.domain.notification.DispatchPolicy;
import com.cruisetracker.tracker.domain.notification.NotificationChannel;
import com.cruisetracker.tracker.domain.notification.NotificationDispatcher;
import com.cruisetracker.tracker.domain.notification.NotificationRecordRepository;
import com.cruisetracker.tracker.domain.run.RunOrchestrator;
import com.cruisetracker.tracker.domain.run.RunPolicy;
import com.cruisetracker.tracker.domain.snapshot.RawCaptureRepository;
import com.cruisetracker.tracker.domain.snapshot.RunWindow;
import com.cruisetracker.tracker.domain.snapshot.SnapshotRepository;
import com.cruisetracker.tracker.domain.snapshot.SnapshotStore;
import com.cruisetracker.tracker.domain.trend.BaselinePolicy;
import com.cruisetracker.tracker.domain.trend.TrendAnalyzer;
import com.cruisetracker.tracker.infrastructure.notification.NotificationCredentials;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the domain services from {@link TrackerProperties}. Domain classes only ever see the
 * policy records built here.
 */
@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NotificationCredentials notificationCredentials() {
        return NotificationCredentials.fromEnvironment(System.getenv());
    }

    @Bean
    public SnapshotStore snapshotStore(SnapshotRepository snapshotRepository, RawCaptureRepository rawCaptureRepository,
                                       TrackerProperties properties) {
        return new SnapshotStore(snapshotRepository, rawCaptureRepository, new RunWindow(properties.store().runGranularity()));
    }

    @Bean
    public Fetcher fetcher(PageClient pageClient, SnapshotStore snapshotStore, TrackerProperties properties, Clock clock) {
        var fetch = properties.fetch();
        var policy = new FetchPolicy(fetch.maxInFlight(), fetch.minIntervalPerHost(), fetch.retry().toPolicy());
        return new Fetcher(pageClient, snapshotStore, policy,
                new HostRateLimiter(policy.minIntervalPerHost(), clock, Sleeper.THREAD),
                new RetryExecutor(policy.retry()),
                clock);
    }

    @Bean
    public StrategyChainFactory strategyChainFactory(TrackerProperties properties) {
        return new StrategyChainFactory(new CandidateValidator(properties.extraction().sailDateHorizon()));
    }

    @Bean
    public TrendAnalyzer trendAnalyzer(SnapshotStore snapshotStore, TrackerProperties properties, Clock clock) {
        var trend = properties.trend();
        return new TrendAnalyzer(snapshotStore, new BaselinePolicy(trend.maxObservations(), trend.maxAge(), trend.minSamples()), clock);
    }

    @Bean
    public DealDetector dealDetector(DealEventRepository dealEventRepository, TrackerProperties properties, Clock clock) {
        var deal = properties.deal();
        return new DealDetector(new DealThresholds(deal.thresholdRatio(), deal.stddevMultiplier()), dealEventRepository, clock);
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(NotificationChannel channel,
                                                         NotificationRecordRepository recordRepository,
                                                         TrackerProperties properties, Clock clock) {
        var notification = properties.notification();
        return new NotificationDispatcher(channel, recordRepository,
                new DispatchPolicy(notification.dedupWindow(), notification.scoreMargin()),
                new RetryExecutor(notification.retry().toPolicy()),
                clock);
    }

    @Bean
    public RunOrchestrator runOrchestrator(Fetcher fetcher, SelectorConfigSource selectorConfigSource,
                                           StrategyChainFactory strategyChainFactory, SnapshotStore snapshotStore,
                                           TrendAnalyzer trendAnalyzer, DealDetector dealDetector,
                                           NotificationDispatcher notificationDispatcher,
                                           TrackerProperties properties, Clock clock) {
        var run = properties.run();
        var policy = new RunPolicy(run.workers(), run.timeout(), run.inFlightGrace(),
                run.structureChangeThreshold(), run.structureChangeMinSamples());
        return new RunOrchestrator(fetcher, selectorConfigSource, strategyChainFactory, snapshotStore,
                trendAnalyzer, dealDetector, notificationDispatcher, policy, clock);
    }
}
