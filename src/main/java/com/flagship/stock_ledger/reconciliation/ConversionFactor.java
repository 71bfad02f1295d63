package com.flagship.stock_ledger.reconciliation;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Parsed form of an item's {@code factor} field.
 *
 * The stored value is text: either a ratio (alternate = primary x factor) or one of
 * the sentinels {@value #MANUAL} and {@value #NONE}. Sentinels and text without a
 * leading number mean there is no fixed ratio.
 */
public final class ConversionFactor {

    public static final String MANUAL = "Manual";
    public static final String NONE = "-";

    private static final ConversionFactor ABSENT = new ConversionFactor(null);

    private final BigDecimal ratio;

    private ConversionFactor(BigDecimal ratio) {
        this.ratio = ratio;
    }

    public static ConversionFactor parse(String raw) {
        if (raw == null) {
            return ABSENT;
        }
        String trimmed = raw.strip();
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase(MANUAL) || trimmed.equals(NONE)) {
            return ABSENT;
        }
        return QuantityParser.parseLeading(trimmed)
            .map(ConversionFactor::new)
            .orElse(ABSENT);
    }

    public boolean isNumeric() {
        return ratio != null;
    }

    public Optional<BigDecimal> ratio() {
        return Optional.ofNullable(ratio);
    }

    /**
     * Converts a primary quantity into the alternate unit.
     *
     * @throws IllegalStateException if the factor has no numeric ratio
     */
    public BigDecimal convert(BigDecimal primaryQuantity) {
        if (ratio == null) {
            throw new IllegalStateException("Factor has no numeric ratio");
        }
        return QuantityParser.toQuantity(primaryQuantity).multiply(ratio);
    }

    @Override
    public String toString() {
        return ratio != null ? ratio.toPlainString() : MANUAL;
    }
}
