package com.cruisetracker.tracker.infrastructure.db;

import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import org.springframework.stereotype.Component;

@Component
public class ItineraryKeyMapper {

    public String toValue(ItineraryKey key) {
        return key == null ? null : key.value();
    }

    public ItineraryKey fromValue(String value) {
        return value == null ? null : ItineraryKey.parse(value);
    }
}
