package com.scoutmind.core.scrape;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex helpers for pulling prices, ratings, counts and URLs out of page text.
 */
public final class TextExtractors {

    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern PRICE = Pattern.compile("\\$[\\d,]+\\.?\\d*");
    private static final Pattern RATING_OUT_OF_FIVE = Pattern.compile("(\\d+\\.?\\d*)\\s*(?:out of|/)\\s*5");
    private static final Pattern DECIMAL_RATING = Pattern.compile("\\b([0-5]\\.\\d+)\\b");
    private static final Pattern LEADING_NUMBER = Pattern.compile("(\\d+\\.?\\d*)");
    private static final Pattern COUNT = Pattern.compile("(\\d+)");

    private TextExtractors() {}

    /**
     * First http(s) URL in the text, up to the next whitespace.
     */
    public static Optional<String> firstUrl(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = URL.matcher(text);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    public static boolean containsUrl(String text) {
        return firstUrl(text).isPresent();
    }

    /**
     * Price with its dollar sign, e.g. {@code $1,299.00}.
     */
    public static Optional<String> price(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = PRICE.matcher(text);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    /**
     * Rating on a 0-5 scale. Prefers "4.5 out of 5" / "4.5/5" phrasing, then a
     * bare decimal between 0 and 5.
     */
    public static Optional<Double> rating(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = RATING_OUT_OF_FIVE.matcher(text);
        if (m.find()) {
            return inRange(Double.parseDouble(m.group(1)));
        }
        m = DECIMAL_RATING.matcher(text);
        if (m.find()) {
            return inRange(Double.parseDouble(m.group(1)));
        }
        return Optional.empty();
    }

    /**
     * First number in the text, accepted only when it is a valid 0-5 rating.
     * Used for star widgets whose text is just "4.2".
     */
    public static Optional<Double> leadingRating(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = LEADING_NUMBER.matcher(text);
        return m.find() ? inRange(Double.parseDouble(m.group(1))) : Optional.empty();
    }

    /**
     * First integer in the text after removing thousands separators,
     * e.g. "12,345 ratings" gives 12345.
     */
    public static Optional<Integer> count(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = COUNT.matcher(text.replace(",", ""));
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Cuts text to {@code maxLength} characters and appends a marker when cut.
     */
    public static String truncate(String text, int maxLength, String marker) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + marker;
    }

    public static String truncate(String text, int maxLength) {
        return truncate(text, maxLength, "...");
    }

    private static Optional<Double> inRange(double value) {
        return value >= 0 && value <= 5 ? Optional.of(value) : Optional.empty();
    }
}
