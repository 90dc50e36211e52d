package com.cruisetracker.tracker.domain.extraction;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One independent way of reading a price observation out of fetched content.
 * Implementations hold only immutable configuration.
 */
public interface ExtractionStrategy {

    String name();

    Set<ExtractionField> producibleFields();

    /**
     * A price read under a cabin hint must come from that cabin's part of the page. When the
     * strategy cannot locate it, the attempt is not applicable.
     *
     * @return the fields this strategy found, or empty when the content is not in a shape it understands
     */
    Optional<CandidateFields> attempt(String content, ExtractionHints hints);

    List<String> validate(CandidateFields candidate, LocalDate referenceDate);
}
