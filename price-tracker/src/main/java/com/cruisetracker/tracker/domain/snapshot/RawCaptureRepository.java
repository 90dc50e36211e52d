package com.cruisetracker.tracker.domain.snapshot;

import com.cruisetracker.tracker.domain.fetch.RawCapture;
import java.util.List;

public interface RawCaptureRepository {

    void insert(RawCapture capture);

    List<RawCapture> findByItinerary(String itineraryId);
}
