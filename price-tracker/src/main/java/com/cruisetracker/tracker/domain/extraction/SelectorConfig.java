package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-strategy keys, CSS selectors and regex patterns, loaded from the selector file.
 * Any selector may be null, in which case the strategy does not look for that field.
 */
public record SelectorConfig(String defaultCurrency, Structured structured, Dom dom, Regex regex) {

    public record Structured(
            String scriptSelector,
            List<String> priceKeys,
            List<String> currencyKeys,
            List<String> shipKeys,
            List<String> departurePortKeys,
            List<String> nightsKeys,
            List<String> sailDateKeys,
            List<String> cabinKeys
    ) {

        public Structured {
            priceKeys = nullToEmpty(priceKeys);
            currencyKeys = nullToEmpty(currencyKeys);
            shipKeys = nullToEmpty(shipKeys);
            departurePortKeys = nullToEmpty(departurePortKeys);
            nightsKeys = nullToEmpty(nightsKeys);
            sailDateKeys = nullToEmpty(sailDateKeys);
            cabinKeys = nullToEmpty(cabinKeys);
        }
    }

    /**
     * {@code cabinCard} is a selector template in which {@code {cabin}} is replaced by
     * {@link CabinCategory#siteLabel()};
     * {@code cabinPrice} selects the price inside that card.
     */
    public record Dom(
            String container,
            String price,
            String cabinCard,
            String cabinPrice,
            String ship,
            String departurePort,
            String nights,
            String sailDate,
            String cabin
    ) {

        public static final String CABIN_PLACEHOLDER = "{cabin}";

        public String cabinCardFor(CabinCategory category) {
            return cabinCard.replace(CABIN_PLACEHOLDER, category.siteLabel());
        }
    }

    public record Regex(
            String price,
            String ship,
            String departurePort,
            String nights,
            String sailDate,
            String cabin
    ) {
    }

    public List<String> problems() {
        var problems = new ArrayList<String>();
        if (defaultCurrency == null || defaultCurrency.isBlank()) {
            problems.add("defaultCurrency is required");
        }
        if (structured == null || structured.priceKeys().isEmpty()) {
            problems.add("structured.priceKeys must not be empty");
        }
        if (dom == null || dom.price() == null) {
            problems.add("dom.price is required");
        }
        if (dom != null && dom.cabinCard() != null) {
            if (!dom.cabinCard().contains(Dom.CABIN_PLACEHOLDER)) {
                problems.add("dom.cabinCard must contain " + Dom.CABIN_PLACEHOLDER);
            }
            if (dom.cabinPrice() == null) {
                problems.add("dom.cabinPrice is required with dom.cabinCard");
            }
        }
        if (regex == null || regex.price() == null) {
            problems.add("regex.price is required");
        }
        return problems;
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
