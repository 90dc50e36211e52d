package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;

public class CandidateValidator {

    static final int MIN_NIGHTS = 1;
    static final int MAX_NIGHTS = 60;

    private final Period sailDateHorizon;

    public CandidateValidator(Period sailDateHorizon) {
        this.sailDateHorizon = sailDateHorizon;
    }

    /**
     * Returns the reasons the candidate cannot become a snapshot; empty when it is valid.
     * Sail dates are checked against {@code [referenceDate, referenceDate + horizon]}.
     */
    public List<String> violations(CandidateFields candidate, LocalDate referenceDate) {
        var violations = new ArrayList<String>();
        if (candidate.price() == null || candidate.price().compareTo(BigDecimal.ZERO) <= 0) {
            violations.add("price missing or not positive: " + candidate.price());
        }
        if (candidate.currency() == null || candidate.currency().isBlank()) {
            violations.add("currency missing");
        }
        if (!ItineraryKey.isKeyable(candidate.ship())) {
            violations.add("ship missing");
        }
        if (!ItineraryKey.isKeyable(candidate.departurePort())) {
            violations.add("departure port missing");
        }
        if (candidate.nights() == null || candidate.nights() < MIN_NIGHTS || candidate.nights() > MAX_NIGHTS) {
            violations.add("nights outside [" + MIN_NIGHTS + ", " + MAX_NIGHTS + "]: " + candidate.nights());
        }
        if (candidate.sailDate() == null) {
            violations.add("sail date missing");
        } else if (candidate.sailDate().isBefore(referenceDate)) {
            violations.add("sail date " + candidate.sailDate() + " is before capture date " + referenceDate);
        } else if (candidate.sailDate().isAfter(referenceDate.plus(sailDateHorizon))) {
            violations.add("sail date " + candidate.sailDate() + " is beyond the " + sailDateHorizon + " horizon");
        }
        if (candidate.cabinCategory() == null) {
            violations.add("cabin category missing");
        }
        return violations;
    }
}
