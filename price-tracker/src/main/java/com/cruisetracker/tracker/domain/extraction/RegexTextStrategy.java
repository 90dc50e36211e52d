package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;

/**
 * Last resort: regular expressions over the visible text of the page. Each pattern's first
 * capturing group (or the whole match when it has none) is the field value. With a cabin hint the
 * price must follow a label of that cabin.
 */
public class RegexTextStrategy extends AbstractExtractionStrategy {

    public static final String NAME = "regex";

    private final Pattern price;
    private final Pattern ship;
    private final Pattern departurePort;
    private final Pattern nights;
    private final Pattern sailDate;
    private final Pattern cabin;

    public RegexTextStrategy(SelectorConfig.Regex patterns, String defaultCurrency, CandidateValidator validator) {
        super(validator, defaultCurrency);
        this.price = compile(patterns.price());
        this.ship = compile(patterns.ship());
        this.departurePort = compile(patterns.departurePort());
        this.nights = compile(patterns.nights());
        this.sailDate = compile(patterns.sailDate());
        this.cabin = compile(patterns.cabin());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ExtractionField> producibleFields() {
        var fields = EnumSet.of(ExtractionField.PRICE, ExtractionField.CURRENCY);
        if (ship != null) {
            fields.add(ExtractionField.SHIP);
        }
        if (departurePort != null) {
            fields.add(ExtractionField.DEPARTURE_PORT);
        }
        if (nights != null) {
            fields.add(ExtractionField.NIGHTS);
        }
        if (sailDate != null) {
            fields.add(ExtractionField.SAIL_DATE);
        }
        if (cabin != null) {
            fields.add(ExtractionField.CABIN_CATEGORY);
        }
        return fields;
    }

    @Override
    public Optional<CandidateFields> attempt(String content, ExtractionHints hints) {
        var text = Jsoup.parse(content == null ? "" : content).text();
        var hintedCabin = hints.cabinCategory();
        String priceText;
        CabinCategory cabinCategory;
        if (hintedCabin == null) {
            priceText = match(price, text);
            cabinCategory = FieldParsers.parseCabin(match(cabin, text)).orElse(null);
        } else {
            priceText = priceAfterCabinLabel(text, hintedCabin);
            cabinCategory = hintedCabin;
        }
        if (priceText == null) {
            return Optional.empty();
        }
        var parsed = FieldParsers.parsePrice(priceText, defaultCurrency);
        return Optional.of(CandidateFields.builder()
                .price(parsed.map(ParsedPrice::amount).orElse(null))
                .currency(parsed.map(ParsedPrice::currency).orElse(defaultCurrency))
                .ship(FieldParsers.cleanText(match(ship, text)))
                .departurePort(FieldParsers.cleanText(match(departurePort, text)))
                .nights(FieldParsers.parseNights(match(nights, text)).orElse(null))
                .sailDate(FieldParsers.parseSailDate(match(sailDate, text)).orElse(null))
                .cabinCategory(cabinCategory)
                .build());
    }

    /**
     * First price between a label of {@code category} and the next cabin label of any kind.
     */
    private String priceAfterCabinLabel(String text, CabinCategory category) {
        if (cabin == null) {
            return null;
        }
        var labels = cabin.matcher(text);
        var found = labels.find();
        while (found) {
            var label = labels.groupCount() > 0 ? labels.group(1) : labels.group();
            var segmentStart = labels.end();
            found = labels.find();
            if (FieldParsers.parseCabin(label).filter(category::equals).isEmpty()) {
                continue;
            }
            var segmentEnd = found ? labels.start() : text.length();
            var priceText = match(price, text.substring(segmentStart, segmentEnd));
            if (priceText != null) {
                return priceText;
            }
        }
        return null;
    }

    private static Pattern compile(String regex) {
        return regex == null ? null : Pattern.compile(regex);
    }

    private static String match(Pattern pattern, String text) {
        if (pattern == null) {
            return null;
        }
        var matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
    }
}
