package com.cruisetracker.tracker.domain.snapshot;

import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only snapshot log. There is deliberately no update or delete.
 */
public interface SnapshotRepository {

    /**
     * @return false when a row with the same dedup key already exists
     */
    boolean insert(Snapshot snapshot, String dedupKey);

    Optional<Snapshot> findLatest(ItineraryKey key);

    /** Ascending by capture time, {@code from} inclusive and {@code to} exclusive. */
    List<Snapshot> findBetween(ItineraryKey key, Instant from, Instant to);

    List<Snapshot> findAll(ItineraryKey key);

    /** The newest {@code limit} snapshots in {@code [notBefore, before)}, returned ascending. */
    List<Snapshot> findRecent(ItineraryKey key, Instant notBefore, Instant before, int limit);

    List<Snapshot> findLatestPerItinerary();

    List<Snapshot> findAllOrdered();

    void verifyAvailable();
}
