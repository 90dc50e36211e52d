package com.cruisetracker.tracker.domain.export;

import com.cruisetracker.tracker.domain.snapshot.SnapshotStore;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Regenerates the flattened export from the snapshot log, which stays the source of truth.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotExportService {

    private final SnapshotStore snapshotStore;
    private final SnapshotExporter exporter;

    public int export(Path target) {
        var rows = exporter.write(snapshotStore.allSnapshots(), target);
        log.info("export.completed: path={}, rows={}", target, rows);
        return rows;
    }
}
