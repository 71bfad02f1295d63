package com.flagship.stock_ledger.ledger;

import java.util.Locale;

/**
 * Direction of a stock movement.
 * IN adds to stock, OUT removes from it.
 */
public enum MovementType {
    IN,
    OUT;

    /**
     * Lenient parse: whitespace and case are ignored, and absent or unknown
     * values fall back to {@link #IN}.
     */
    public static MovementType parse(String raw) {
        if (raw == null) {
            return IN;
        }
        String normalized = raw.strip().toUpperCase(Locale.ROOT);
        return OUT.name().equals(normalized) ? OUT : IN;
    }

    public int sign() {
        return this == IN ? 1 : -1;
    }
}
