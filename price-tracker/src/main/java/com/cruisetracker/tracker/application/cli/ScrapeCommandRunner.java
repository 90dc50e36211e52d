package com.cruisetracker.tracker.application.cli;

import com.cruisetracker.tracker.application.config.TrackerProperties;
import com.cruisetracker.tracker.domain.exceptions.SelectorConfigException;
import com.cruisetracker.tracker.domain.exceptions.SnapshotStoreUnavailableException;
import com.cruisetracker.tracker.domain.export.SnapshotExportService;
import com.cruisetracker.tracker.domain.run.RunOrchestrator;
import com.cruisetracker.tracker.domain.snapshot.SnapshotStore;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point.
 *
 * <pre>
 *   --scrape                 run one scrape cycle over the configured itineraries
 *   --max-itineraries=N      limit the cycle to the first N itineraries
 *   --export[=path]          regenerate the CSV export from the snapshot log
 * </pre>
 *
 * Exit code is 0 when the run completed, even with per-itinerary failures, and 2 on a run-level fatal condition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 2;

    static final String USAGE = """
            Usage: cruise-price-tracker [--scrape [--max-itineraries=N]] [--export[=path]]
              --scrape              fetch all tracked itineraries, store snapshots, detect deals and notify
              --max-itineraries=N   only process the first N tracked itineraries
              --export[=path]       rewrite the flattened CSV export from the snapshot log""";

    private final RunOrchestrator runOrchestrator;
    private final SnapshotStore snapshotStore;
    private final SnapshotExportService exportService;
    private final RunMetricsRecorder metricsRecorder;
    private final TrackerProperties properties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        var scrape = args.containsOption("scrape");
        var export = args.containsOption("export");
        if (!scrape && !export) {
            log.info("\n{}", USAGE);
            return;
        }
        if (scrape) {
            exitCode = scrape(maxItineraries(args));
            if (exitCode != EXIT_OK) {
                return;
            }
        }
        exitCode = export(exportPath(args), export);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int scrape(Integer limit) {
        try {
            snapshotStore.verifyAvailable();
        } catch (SnapshotStoreUnavailableException e) {
            log.error("run.fatal: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
        var itineraries = properties.itineraries().stream()
                .limit(limit == null ? Long.MAX_VALUE : limit)
                .map(TrackerProperties.Itinerary::toTracked)
                .toList();
        try {
            var summary = runOrchestrator.run(itineraries);
            metricsRecorder.record(summary);
            return EXIT_OK;
        } catch (SelectorConfigException e) {
            log.error("run.fatal: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    /**
     * After a scrape the export is refreshed best-effort; an explicit {@code --export} failure is fatal.
     */
    private int export(Path target, boolean requested) {
        try {
            exportService.export(target);
            return EXIT_OK;
        } catch (RuntimeException e) {
            log.error("export.failed: path={}, reason={}", target, e.getMessage(), e);
            return requested ? EXIT_FATAL : EXIT_OK;
        }
    }

    private Integer maxItineraries(ApplicationArguments args) {
        var values = args.getOptionValues("max-itineraries");
        if (values == null || values.isEmpty()) {
            return null;
        }
        var limit = Integer.parseInt(values.get(0));
        if (limit < 0) {
            throw new IllegalArgumentException("--max-itineraries must be >= 0, was " + limit);
        }
        return limit;
    }

    private Path exportPath(ApplicationArguments args) {
        List<String> values = args.getOptionValues("export");
        if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
            return Path.of(values.get(0));
        }
        return Path.of(properties.export().path());
    }
}
