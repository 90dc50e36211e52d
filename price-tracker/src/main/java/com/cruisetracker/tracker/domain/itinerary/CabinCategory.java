package com.cruisetracker.tracker.domain.itinerary;

import java.util.Locale;
import java.util.Optional;

/**
 * Cabin grades quoted by the upstream site. Labels vary between page versions
 * ("Ocean View", "OUTSIDE", "ocean_view"), so parsing accepts all known aliases.
 * {@link #siteLabel()} is the suffix the site uses on its per-cabin room cards.
 */
public enum CabinCategory {
    INTERIOR("INTERIOR", "INTERIOR", "INSIDE"),
    OCEAN_VIEW("OUTSIDE", "OCEAN VIEW", "OCEANVIEW", "OUTSIDE"),
    BALCONY("BALCONY", "BALCONY", "VERANDAH"),
    SUITE("DELUXE", "SUITE", "SUITES", "DELUXE");

    private final String siteLabel;
    private final String[] aliases;

    CabinCategory(String siteLabel, String... aliases) {
        this.siteLabel = siteLabel;
        this.aliases = aliases;
    }

    public String siteLabel() {
        return siteLabel;
    }

    public static Optional<CabinCategory> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        var normalized = label.trim().toUpperCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
        for (var category : values()) {
            if (category.name().replace('_', ' ').equals(normalized)) {
                return Optional.of(category);
            }
            for (var alias : category.aliases) {
                if (alias.equals(normalized)) {
                    return Optional.of(category);
                }
            }
        }
        return Optional.empty();
    }
}
