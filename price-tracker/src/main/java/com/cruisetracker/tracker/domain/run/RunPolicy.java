package com.cruisetracker.tracker.domain.run;

import java.time.Duration;

/**
 * @param structureChangeThreshold   fraction of fetched pages failing extraction that flags a site change
 * @param structureChangeMinSamples  minimum fetched pages before the flag may be raised
 */
public record RunPolicy(
        int workers,
        Duration timeout,
        Duration inFlightGrace,
        double structureChangeThreshold,
        int structureChangeMinSamples
) {
}
