package com.cruisetracker.tracker.infrastructure.export;

import com.cruisetracker.common.json.JacksonConfig;
import com.cruisetracker.tracker.domain.export.SnapshotExporter;
import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.dataformat.csv.CsvMapper;

/**
 * Writes the flattened CSV view next to the target and moves it into place, so readers never see a
 * half-written file.
 */
@Slf4j
@Component
public class CsvSnapshotExporter implements SnapshotExporter {

    private final CsvMapper csvMapper;

    public CsvSnapshotExporter() {
        this(JacksonConfig.createCsvMapper());
    }

    CsvSnapshotExporter(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    @Override
    public int write(List<Snapshot> snapshots, Path target) {
        var rows = snapshots.stream().map(SnapshotCsvRow::from).toList();
        var schema = csvMapper.schemaFor(SnapshotCsvRow.class).withHeader();
        var directory = target.toAbsolutePath().getParent();
        Path temp = null;
        var moved = false;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try (var out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                csvMapper.writer(schema).writeValue(out, rows);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            moved = true;
            return rows.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write export " + target, e);
        } finally {
            if (!moved) {
                deleteQuietly(temp);
            }
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary export file {}: {}", temp, e.getMessage());
        }
    }
}
