package com.trucksafe.elp.service;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns the date text found in FMCSA extracts into a calendar month.
 *
 * Encodings, tried in this order:
 * <ol>
 *   <li>{@code 20250615} compact, optionally followed by a time ("20250615 1432")</li>
 *   <li>{@code 2025-06-15} ISO, optionally with a time after 'T' or a space</li>
 *   <li>{@code 15-JUN-25} Oracle style, any case; years 69-99 are 19xx, 00-68 are 20xx</li>
 *   <li>{@code 06/15/2025} or {@code 6/15/2025}</li>
 * </ol>
 * Dates are validated strictly, so 2025-02-30 is no date at all.
 */
@Component
public class DateNormalizer {

    private static final DateTimeFormatter COMPACT = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final DateTimeFormatter DAY_MONTH_YEAR = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
            .toFormatter(Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter SLASHED = DateTimeFormatter.ofPattern("M/d/uuuu", Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * @param raw date text, may be null
     * @return the month, or empty when no known encoding parses
     */
    public Optional<YearMonth> normalize(String raw) {
        if (raw == null) return Optional.empty();
        String text = raw.trim();
        if (text.isEmpty()) return Optional.empty();

        LocalDate date = parseCompact(text);
        if (date == null) date = parseIso(text);
        if (date == null) date = parse(text, DAY_MONTH_YEAR);
        if (date == null) date = parse(text, SLASHED);

        return Optional.ofNullable(date).map(YearMonth::from);
    }

    private LocalDate parseCompact(String text) {
        String first = firstToken(text);
        if (first.length() != 8 || !first.chars().allMatch(Character::isDigit)) {
            return null;
        }
        return parse(first, COMPACT);
    }

    private LocalDate parseIso(String text) {
        int cut = text.indexOf('T');
        String datePart = cut > 0 ? text.substring(0, cut) : firstToken(text);
        return parse(datePart, ISO);
    }

    private static LocalDate parse(String text, DateTimeFormatter formatter) {
        try {
            return LocalDate.parse(text, formatter);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String firstToken(String text) {
        int space = text.indexOf(' ');
        return space > 0 ? text.substring(0, space) : text;
    }
}
