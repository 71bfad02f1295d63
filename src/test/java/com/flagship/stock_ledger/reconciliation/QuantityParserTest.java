package com.flagship.stock_ledger.reconciliation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lenient numeric coercion of quantities recorded as text.
 */
class QuantityParserTest {

    @Test
    @DisplayName("Plain numbers parse as-is")
    void testPlainNumbers() {
        assertEquals(0, new BigDecimal("50").compareTo(QuantityParser.toQuantity("50")));
        assertEquals(0, new BigDecimal("12.5").compareTo(QuantityParser.toQuantity("12.5")));
        assertEquals(0, new BigDecimal("-3").compareTo(QuantityParser.toQuantity("-3")));
        assertEquals(0, new BigDecimal("0.5").compareTo(QuantityParser.toQuantity(".5")));
    }

    @Test
    @DisplayName("Unit suffix after the number is ignored")
    void testDecoratedValues() {
        assertEquals(0, new BigDecimal("50").compareTo(QuantityParser.toQuantity("50 box")));
        assertEquals(0, new BigDecimal("12.5").compareTo(QuantityParser.toQuantity("  12.5kg ")));
        assertEquals(0, new BigDecimal("100").compareTo(QuantityParser.toQuantity("1e2 pcs")));
    }

    @Test
    @DisplayName("Values without a leading number coerce to zero")
    void testNonNumericCoercesToZero() {
        assertEquals(BigDecimal.ZERO, QuantityParser.toQuantity((String) null));
        assertEquals(BigDecimal.ZERO, QuantityParser.toQuantity(""));
        assertEquals(BigDecimal.ZERO, QuantityParser.toQuantity("-"));
        assertEquals(BigDecimal.ZERO, QuantityParser.toQuantity("box 50"));
        assertEquals(BigDecimal.ZERO, QuantityParser.toQuantity("Manual"));
        assertTrue(QuantityParser.parseLeading("abc").isEmpty());
    }

    @Test
    @DisplayName("Null stored numbers count as zero")
    void testNullNumber() {
        assertEquals(BigDecimal.ZERO, QuantityParser.toQuantity((BigDecimal) null));
    }

    @Test
    @DisplayName("Formatting yields plain text without trailing zeros")
    void testFormat() {
        assertEquals("50", QuantityParser.format(new BigDecimal("50.0000")));
        assertEquals("100", QuantityParser.format(new BigDecimal("1E+2")));
        assertEquals("2.5", QuantityParser.format(new BigDecimal("2.50")));
        assertEquals("0", QuantityParser.format(new BigDecimal("0.000")));
        assertEquals("0", QuantityParser.format(null));
    }

    @Test
    @DisplayName("Huge exponents coerce to zero and stay usable in arithmetic")
    void testHugeExponent() {
        // Given
        String stored = "1e999999999";

        // When
        BigDecimal value = QuantityParser.toQuantity(stored);

        // Then
        assertEquals(BigDecimal.ZERO, value);
        assertEquals(0, new BigDecimal("0.5").compareTo(value.add(new BigDecimal("0.5"))));
        assertTrue(QuantityParser.parseLeading(stored).isEmpty());
        assertFalse(QuantityParser.isWithinRange(stored));
    }

    @Test
    @DisplayName("Exponent beyond int range coerces to zero")
    void testExponentOverflow() {
        assertEquals(BigDecimal.ZERO, QuantityParser.toQuantity("1e99999999999"));
        assertFalse(QuantityParser.isWithinRange("1e99999999999 box"));
    }

    @Test
    @DisplayName("Vanishingly small values coerce to zero")
    void testTinyValues() {
        assertEquals(BigDecimal.ZERO, QuantityParser.toQuantity("1e-999999999"));
        assertTrue(QuantityParser.isWithinRange("1e-999999999"));
    }

    @Test
    @DisplayName("Fifteen integer digits are accepted, sixteen are not")
    void testIntegerDigitLimit() {
        assertEquals(0, new BigDecimal("999999999999999")
            .compareTo(QuantityParser.toQuantity("999999999999999")));
        assertEquals(BigDecimal.ZERO, QuantityParser.toQuantity("1000000000000000"));
        assertFalse(QuantityParser.isWithinRange("1e15"));
    }

    @Test
    @DisplayName("Fractions are rounded half-up to six digits")
    void testFractionRounding() {
        assertEquals(new BigDecimal("0.123457"), QuantityParser.toQuantity("0.1234567"));
        assertEquals(0, new BigDecimal("0.000001").compareTo(QuantityParser.toQuantity("5e-7")));
    }

    @Test
    @DisplayName("Text without a leading number is within range")
    void testNonNumericIsWithinRange() {
        assertTrue(QuantityParser.isWithinRange(null));
        assertTrue(QuantityParser.isWithinRange("Manual"));
        assertTrue(QuantityParser.isWithinRange("50 box"));
        assertTrue(QuantityParser.bound(null).isEmpty());
    }
}
