package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw field values (JSON scalars or page text) into typed candidate fields.
 * Shared by every extraction strategy so that all of them normalize identically.
 */
public final class FieldParsers {

    private static final Map<String, String> CURRENCY_SYMBOLS = Map.of("$", "USD", "£", "GBP", "€", "EUR");
    private static final Pattern CURRENCY_SYMBOL = Pattern.compile("[$£€]");
    private static final Pattern CURRENCY_CODE = Pattern.compile("\\b(USD|GBP|EUR|CAD|AUD)\\b");
    private static final Pattern AMOUNT = Pattern.compile("(\\d{1,3}(?:,\\d{3})+|\\d+)(\\.\\d{1,2})?");
    private static final Pattern NIGHTS = Pattern.compile("(\\d{1,3})\\s*-?\\s*nights?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGITS_ONLY = Pattern.compile("\\d{1,3}");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern YEAR = Pattern.compile("\\b(20\\d{2})\\b");
    private static final Pattern RANGE_SEPARATOR = Pattern.compile("\\s+[-\\u2013]\\s+");
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile("(\\d{1,2})\\s+([A-Za-z]{3,9})\\.?,?\\s+(\\d{4})");
    private static final Pattern MONTH_DAY_YEAR = Pattern.compile("([A-Za-z]{3,9})\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})");

    private FieldParsers() {
    }

    public static Optional<ParsedPrice> parsePrice(Object raw, String defaultCurrency) {
        if (raw instanceof Number number) {
            return Optional.of(new ParsedPrice(scale(new BigDecimal(number.toString())), defaultCurrency));
        }
        if (raw == null) {
            return Optional.empty();
        }
        var text = raw.toString();
        var amount = AMOUNT.matcher(text);
        if (!amount.find()) {
            return Optional.empty();
        }
        var digits = amount.group(1).replace(",", "") + (amount.group(2) == null ? "" : amount.group(2));
        return Optional.of(new ParsedPrice(scale(new BigDecimal(digits)), currencyOf(text).orElse(defaultCurrency)));
    }

    public static Optional<String> currencyOf(String text) {
        if (text == null) {
            return Optional.empty();
        }
        var code = CURRENCY_CODE.matcher(text.toUpperCase(Locale.ROOT));
        if (code.find()) {
            return Optional.of(code.group(1));
        }
        var symbol = CURRENCY_SYMBOL.matcher(text);
        return symbol.find() ? Optional.of(CURRENCY_SYMBOLS.get(symbol.group())) : Optional.empty();
    }

    public static Optional<Integer> parseNights(Object raw) {
        if (raw instanceof Number number) {
            return Optional.of(number.intValue());
        }
        if (raw == null) {
            return Optional.empty();
        }
        var text = raw.toString().trim();
        if (DIGITS_ONLY.matcher(text).matches()) {
            return Optional.of(Integer.parseInt(text));
        }
        var matcher = NIGHTS.matcher(text);
        return matcher.find() ? Optional.of(Integer.parseInt(matcher.group(1))) : Optional.empty();
    }

    /**
     * Accepts ISO dates (optionally with a time part), "22 Aug 2026", "Aug 22, 2026" and ranges such as
     * "Saturday 22 Aug - Saturday 29 Aug 2026", where the start date borrows the year of the end date
     * (the year before when the range crosses New Year).
     */
    public static Optional<LocalDate> parseSailDate(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        var text = raw.toString().trim();
        var iso = ISO_DATE.matcher(text);
        if (iso.find()) {
            try {
                return Optional.of(LocalDate.parse(iso.group()));
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
        var parts = RANGE_SEPARATOR.split(text);
        var start = parts[0];
        if (YEAR.matcher(start).find()) {
            return parseWrittenDate(start);
        }
        var year = lastYear(text);
        if (year == null) {
            return Optional.empty();
        }
        var startDate = parseWrittenDate(start + " " + year);
        if (parts.length < 2 || startDate.isEmpty()) {
            return startDate;
        }
        // "28 Dec - 4 Jan 2027" starts in the year before the one printed
        var endDate = parseWrittenDate(parts[parts.length - 1]);
        if (endDate.isPresent() && startDate.get().isAfter(endDate.get())) {
            return Optional.of(startDate.get().minusYears(1));
        }
        return startDate;
    }

    private static Optional<LocalDate> parseWrittenDate(String text) {
        var dayFirst = DAY_MONTH_YEAR.matcher(text);
        if (dayFirst.find()) {
            return toDate(dayFirst.group(3), dayFirst.group(2), dayFirst.group(1));
        }
        var monthFirst = MONTH_DAY_YEAR.matcher(text);
        if (monthFirst.find()) {
            return toDate(monthFirst.group(3), monthFirst.group(1), monthFirst.group(2));
        }
        return Optional.empty();
    }

    public static Optional<CabinCategory> parseCabin(Object raw) {
        return raw == null ? Optional.empty() : CabinCategory.fromLabel(raw.toString());
    }

    public static String cleanText(Object raw) {
        if (raw == null) {
            return null;
        }
        var text = raw.toString().replaceAll("\\s+", " ").trim();
        return text.isEmpty() ? null : text;
    }

    private static BigDecimal scale(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static String lastYear(String text) {
        String year = null;
        Matcher matcher = YEAR.matcher(text);
        while (matcher.find()) {
            year = matcher.group(1);
        }
        return year;
    }

    private static Optional<LocalDate> toDate(String year, String monthName, String day) {
        var prefix = monthName.substring(0, 3).toUpperCase(Locale.ROOT);
        for (var month : Month.values()) {
            if (month.name().startsWith(prefix)) {
                try {
                    return Optional.of(LocalDate.of(Integer.parseInt(year), month, Integer.parseInt(day)));
                } catch (DateTimeException e) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }
}
