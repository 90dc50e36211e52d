package com.cruisetracker.tracker.domain.export;

import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import java.nio.file.Path;
import java.util.List;

public interface SnapshotExporter {

    /**
     * Replaces {@code target} with a flattened view of {@code snapshots}.
     *
     * @return rows written
     */
    int write(List<Snapshot> snapshots, Path target);
}
