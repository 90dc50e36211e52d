package com.cruisetracker.tracker.domain.snapshot;

import com.cruisetracker.tracker.domain.fetch.RawCapture;
import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Sole writer of snapshots and raw captures.
 *
 * <p>A candidate whose price equals the last stored price for its key within the same run window is
 * reported as {@link AppendResult#DEDUPLICATED}. Appends for one key are serialized in-process by a
 * per-key lock; the dedup key unique constraint covers concurrent processes.
 */
@Slf4j
public class SnapshotStore {

    private final SnapshotRepository snapshotRepository;
    private final RawCaptureRepository rawCaptureRepository;
    private final RunWindow runWindow;
    private final ConcurrentMap<ItineraryKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public SnapshotStore(SnapshotRepository snapshotRepository, RawCaptureRepository rawCaptureRepository, RunWindow runWindow) {
        this.snapshotRepository = snapshotRepository;
        this.rawCaptureRepository = rawCaptureRepository;
        this.runWindow = runWindow;
    }

    public AppendResult append(Snapshot candidate) {
        var key = candidate.itineraryKey();
        var lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            var last = snapshotRepository.findLatest(key);
            if (last.isPresent() && isRepeat(last.get(), candidate)) {
                log.debug("snapshot.deduplicated: key={}, price={}, existing={}", key, candidate.price(), last.get().id());
                return AppendResult.DEDUPLICATED;
            }
            var dedupKey = dedupKey(candidate, last.map(Snapshot::id).orElse("-"));
            if (!snapshotRepository.insert(candidate, dedupKey)) {
                log.info("snapshot.deduplicated: key={}, price={}, reason=concurrent-writer", key, candidate.price());
                return AppendResult.DEDUPLICATED;
            }
            log.info("snapshot.stored: id={}, key={}, price={} {}, strategy={}",
                    candidate.id(), key, candidate.price(), candidate.currency(), candidate.sourceStrategy());
            return AppendResult.STORED;
        } finally {
            lock.unlock();
        }
    }

    public void recordCapture(RawCapture capture) {
        rawCaptureRepository.insert(capture);
    }

    public List<RawCapture> captures(String itineraryId) {
        return rawCaptureRepository.findByItinerary(itineraryId);
    }

    public Optional<Snapshot> latest(ItineraryKey key) {
        return snapshotRepository.findLatest(key);
    }

    public List<Snapshot> history(ItineraryKey key) {
        return snapshotRepository.findAll(key);
    }

    public List<Snapshot> history(ItineraryKey key, Instant from, Instant to) {
        return snapshotRepository.findBetween(key, from, to);
    }

    public List<Snapshot> recent(ItineraryKey key, Instant notBefore, Instant before, int limit) {
        return snapshotRepository.findRecent(key, notBefore, before, limit);
    }

    public List<Snapshot> latestPerItinerary() {
        return snapshotRepository.findLatestPerItinerary();
    }

    public List<Snapshot> allSnapshots() {
        return snapshotRepository.findAllOrdered();
    }

    public void verifyAvailable() {
        snapshotRepository.verifyAvailable();
    }

    private boolean isRepeat(Snapshot last, Snapshot candidate) {
        return runWindow.sameWindow(last.capturedAt(), candidate.capturedAt())
                && last.price().compareTo(candidate.price()) == 0;
    }

    private String dedupKey(Snapshot candidate, String predecessorId) {
        return candidate.itineraryKey().value()
                + "|" + runWindow.startOf(candidate.capturedAt()).toEpochMilli()
                + "|" + candidate.price().stripTrailingZeros().toPlainString()
                + "|" + predecessorId;
    }
}
