package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import java.time.LocalDate;

/**
 * Values known from the tracked itinerary itself. They fill fields a page does not carry
 * and never override what a strategy extracted.
 */
public record ExtractionHints(LocalDate sailDate, CabinCategory cabinCategory) {

    public static ExtractionHints none() {
        return new ExtractionHints(null, null);
    }
}
