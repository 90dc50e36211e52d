package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.common.json.JacksonConfig;
import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads embedded structured data: a whole JSON document, or JSON script blocks inside an HTML page.
 * An object carrying a price key anchors the lookup; other fields are searched inside that
 * object first and then across the whole document.
 */
@Slf4j
public class StructuredDataStrategy extends AbstractExtractionStrategy {

    public static final String NAME = "structured";

    private static final ObjectMapper MAPPER = JacksonConfig.createObjectMapper();

    private final SelectorConfig.Structured selectors;

    public StructuredDataStrategy(SelectorConfig.Structured selectors, String defaultCurrency, CandidateValidator validator) {
        super(validator, defaultCurrency);
        this.selectors = selectors;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ExtractionField> producibleFields() {
        return EnumSet.allOf(ExtractionField.class);
    }

    @Override
    public Optional<CandidateFields> attempt(String content, ExtractionHints hints) {
        for (var document : documents(content)) {
            var anchors = new ArrayList<Map<?, ?>>();
            collectAnchors(document, anchors);
            var anchor = chooseAnchor(anchors, hints.cabinCategory());
            if (anchor.isPresent()) {
                return Optional.of(toCandidate(anchor.get(), document));
            }
        }
        return Optional.empty();
    }

    /**
     * Without a cabin hint the first anchor wins. With one, an anchor quoting that cabin wins; anchors
     * quoting other cabins are never used, and an anchor without a cabin of its own is used only when
     * no anchor in the document names a cabin.
     */
    private Optional<Map<?, ?>> chooseAnchor(List<Map<?, ?>> anchors, CabinCategory hinted) {
        if (anchors.isEmpty()) {
            return Optional.empty();
        }
        if (hinted == null) {
            return Optional.of(anchors.get(0));
        }
        var anyCabinQuoted = false;
        for (var anchor : anchors) {
            var cabin = find(anchor, selectors.cabinKeys()).flatMap(FieldParsers::parseCabin);
            if (cabin.isPresent() && cabin.get() == hinted) {
                return Optional.of(anchor);
            }
            anyCabinQuoted |= cabin.isPresent();
        }
        return anyCabinQuoted ? Optional.empty() : Optional.of(anchors.get(0));
    }

    private List<Object> documents(String content) {
        var documents = new ArrayList<Object>();
        var trimmed = content == null ? "" : content.strip();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            parse(trimmed).ifPresent(documents::add);
            return documents;
        }
        if (selectors.scriptSelector() == null) {
            return documents;
        }
        for (var script : Jsoup.parse(trimmed).select(selectors.scriptSelector())) {
            parse(script.data()).ifPresent(documents::add);
        }
        return documents;
    }

    private Optional<Object> parse(String json) {
        try {
            return Optional.ofNullable(MAPPER.readValue(json, Object.class));
        } catch (JacksonException e) {
            log.debug("Skipping unparseable JSON block: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private CandidateFields toCandidate(Map<?, ?> anchor, Object document) {
        var rawPrice = find(anchor, selectors.priceKeys()).orElse(null);
        var price = FieldParsers.parsePrice(rawPrice, defaultCurrency);
        var currency = lookup(anchor, document, selectors.currencyKeys())
                .map(Object::toString)
                .or(() -> price.map(ParsedPrice::currency))
                .orElse(defaultCurrency);
        return CandidateFields.builder()
                .price(price.map(ParsedPrice::amount).orElse(null))
                .currency(currency)
                .ship(lookup(anchor, document, selectors.shipKeys()).map(FieldParsers::cleanText).orElse(null))
                .departurePort(lookup(anchor, document, selectors.departurePortKeys()).map(FieldParsers::cleanText).orElse(null))
                .nights(lookup(anchor, document, selectors.nightsKeys()).flatMap(FieldParsers::parseNights).orElse(null))
                .sailDate(lookup(anchor, document, selectors.sailDateKeys()).flatMap(FieldParsers::parseSailDate).orElse(null))
                .cabinCategory(lookup(anchor, document, selectors.cabinKeys()).flatMap(FieldParsers::parseCabin).orElse(null))
                .build();
    }

    private void collectAnchors(Object node, List<Map<?, ?>> anchors) {
        if (node instanceof Map<?, ?> map) {
            for (var key : selectors.priceKeys()) {
                if (isScalar(map.get(key))) {
                    anchors.add(map);
                    return;
                }
            }
            for (var value : map.values()) {
                collectAnchors(value, anchors);
            }
        } else if (node instanceof List<?> list) {
            for (var item : list) {
                collectAnchors(item, anchors);
            }
        }
    }

    private static Optional<Object> lookup(Map<?, ?> anchor, Object document, List<String> keys) {
        return find(anchor, keys).or(() -> find(document, keys));
    }

    private static Optional<Object> find(Object node, List<String> keys) {
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        if (node instanceof Map<?, ?> map) {
            for (var key : keys) {
                var value = map.get(key);
                if (isScalar(value)) {
                    return Optional.of(value);
                }
            }
            for (var value : map.values()) {
                var nested = find(value, keys);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        } else if (node instanceof List<?> list) {
            for (var item : list) {
                var nested = find(item, keys);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number;
    }
}
