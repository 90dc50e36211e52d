package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

/**
 * Reads fields from CSS-selected elements of the rendered page, scoped to the configured container.
 * With a cabin hint the price is read from that cabin's room card only.
 */
public class DomPathStrategy extends AbstractExtractionStrategy {

    public static final String NAME = "dom";

    private final SelectorConfig.Dom selectors;

    public DomPathStrategy(SelectorConfig.Dom selectors, String defaultCurrency, CandidateValidator validator) {
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
        Element root = Jsoup.parse(content == null ? "" : content);
        if (selectors.container() != null) {
            root = root.selectFirst(selectors.container());
            if (root == null) {
                return Optional.empty();
            }
        }
        var pageCabin = FieldParsers.parseCabin(text(root, selectors.cabin())).orElse(null);
        var hintedCabin = hints.cabinCategory();
        String priceText;
        CabinCategory cabin;
        if (hintedCabin == null) {
            priceText = text(root, selectors.price());
            cabin = pageCabin;
        } else if (selectors.cabinCard() != null) {
            var card = root.selectFirst(selectors.cabinCardFor(hintedCabin));
            if (card == null) {
                return Optional.empty();
            }
            priceText = text(card, selectors.cabinPrice());
            cabin = hintedCabin;
        } else if (pageCabin == hintedCabin) {
            priceText = text(root, selectors.price());
            cabin = pageCabin;
        } else {
            // the page price cannot be attributed to the tracked cabin
            return Optional.empty();
        }
        if (priceText == null) {
            return Optional.empty();
        }
        var price = FieldParsers.parsePrice(priceText, defaultCurrency);
        return Optional.of(CandidateFields.builder()
                .price(price.map(ParsedPrice::amount).orElse(null))
                .currency(price.map(ParsedPrice::currency).orElse(defaultCurrency))
                .ship(text(root, selectors.ship()))
                .departurePort(text(root, selectors.departurePort()))
                .nights(FieldParsers.parseNights(text(root, selectors.nights())).orElse(null))
                .sailDate(FieldParsers.parseSailDate(text(root, selectors.sailDate())).orElse(null))
                .cabinCategory(cabin)
                .build());
    }

    private static String text(Element root, String selector) {
        if (selector == null) {
            return null;
        }
        var element = root.selectFirst(selector);
        return element == null ? null : FieldParsers.cleanText(element.text());
    }
}
