package com.cruisetracker.tracker.domain.itinerary;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Identity of one bookable sailing: ship, departure port, sail date and cabin category.
 * Components are normalized on construction so the same sailing always yields the same key
 * regardless of casing or punctuation in the page. Canonical form: {@code SHIP|PORT|DATE|CABIN}.
 */
public record ItineraryKey(String ship, String departurePort, LocalDate sailDate, CabinCategory cabinCategory) {

    private static final String SEPARATOR = "|";

    public ItineraryKey {
        ship = normalize(Objects.requireNonNull(ship, "ship"));
        departurePort = normalize(Objects.requireNonNull(departurePort, "departurePort"));
        Objects.requireNonNull(sailDate, "sailDate");
        Objects.requireNonNull(cabinCategory, "cabinCategory");
        if (ship.isEmpty() || departurePort.isEmpty()) {
            throw new IllegalArgumentException("ship and departure port must contain letters or digits");
        }
    }

    public static ItineraryKey parse(String value) {
        var parts = Objects.requireNonNull(value, "value").split("\\|", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Malformed itinerary key: " + value);
        }
        return new ItineraryKey(parts[0], parts[1], LocalDate.parse(parts[2]), CabinCategory.valueOf(parts[3]));
    }

    public String value() {
        return ship + SEPARATOR + departurePort + SEPARATOR + sailDate + SEPARATOR + cabinCategory.name();
    }

    @Override
    public String toString() {
        return value();
    }

    public static boolean isKeyable(String component) {
        return component != null && !normalize(component).isEmpty();
    }

    static String normalize(String raw) {
        var upper = raw.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "-");
        return upper.replaceAll("^-+|-+$", "");
    }
}
