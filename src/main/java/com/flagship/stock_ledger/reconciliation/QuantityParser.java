package com.flagship.stock_ledger.reconciliation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient numeric coercion for quantities recorded as free text.
 *
 * Legacy rows carry decorated values such as "50 box" or "12.5kg". The leading
 * numeric portion is taken and anything after it is ignored. A value with no
 * leading number coerces to zero. Parsing never throws.
 *
 * Parsed values are bounded: magnitudes with more than {@value #MAX_INTEGER_DIGITS}
 * integer digits are treated as non-numeric, and fractions are rounded half-up to
 * {@value #MAX_FRACTION_DIGITS} digits, so "1e999999999" cannot reach arithmetic.
 */
public final class QuantityParser {

    public static final int MAX_INTEGER_DIGITS = 15;
    public static final int MAX_FRACTION_DIGITS = 6;

    private static final Pattern LEADING_NUMBER =
        Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private QuantityParser() {
        // Utility class
    }

    /**
     * Parses the leading number of the given text.
     *
     * @param raw text such as "50", " 50 box", "-3.5kg"
     * @return the number, or empty if the text does not start with one or it is out of range
     */
    public static Optional<BigDecimal> parseLeading(String raw) {
        return leadingNumberText(raw).flatMap(QuantityParser::parseBounded);
    }

    /**
     * True unless the text starts with a number that is out of range.
     * Text without a leading number is in range: it simply coerces to zero.
     */
    public static boolean isWithinRange(String raw) {
        return leadingNumberText(raw)
            .map(text -> parseBounded(text).isPresent())
            .orElse(true);
    }

    /**
     * Applies the parsing bounds to a computed value.
     *
     * @return the value rounded to the supported fraction digits, or empty if too large
     */
    public static Optional<BigDecimal> bound(BigDecimal value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.signum() == 0) {
            return Optional.of(BigDecimal.ZERO);
        }
        // Power of ten of the leading digit: 123.4 -> 2, 0.05 -> -2
        int magnitude = value.precision() - value.scale() - 1;
        if (magnitude >= MAX_INTEGER_DIGITS) {
            return Optional.empty();
        }
        if (magnitude < -(MAX_FRACTION_DIGITS + 1)) {
            return Optional.of(BigDecimal.ZERO);
        }
        if (value.scale() > MAX_FRACTION_DIGITS) {
            return Optional.of(value.setScale(MAX_FRACTION_DIGITS, RoundingMode.HALF_UP));
        }
        return Optional.of(value);
    }

    /**
     * Coerces text to a number, defaulting to zero.
     */
    public static BigDecimal toQuantity(String raw) {
        return parseLeading(raw).orElse(BigDecimal.ZERO);
    }

    /**
     * Null-safe variant for values already stored as numbers.
     */
    public static BigDecimal toQuantity(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /**
     * Renders a quantity as plain decimal text without trailing zeros.
     */
    public static String format(BigDecimal value) {
        if (value == null || value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    private static Optional<String> leadingNumberText(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = LEADING_NUMBER.matcher(raw.strip());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group());
    }

    private static Optional<BigDecimal> parseBounded(String text) {
        try {
            return bound(new BigDecimal(text));
        } catch (NumberFormatException e) {
            // Exponent beyond int range
            return Optional.empty();
        }
    }
}
