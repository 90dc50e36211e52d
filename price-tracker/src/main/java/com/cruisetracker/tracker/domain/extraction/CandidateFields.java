package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;

@Builder(toBuilder = true)
public record CandidateFields(
        BigDecimal price,
        String currency,
        String ship,
        String departurePort,
        Integer nights,
        LocalDate sailDate,
        CabinCategory cabinCategory
) {

    public CandidateFields withHints(ExtractionHints hints) {
        if (hints == null) {
            return this;
        }
        return toBuilder()
                .sailDate(sailDate != null ? sailDate : hints.sailDate())
                .cabinCategory(cabinCategory != null ? cabinCategory : hints.cabinCategory())
                .build();
    }
}
