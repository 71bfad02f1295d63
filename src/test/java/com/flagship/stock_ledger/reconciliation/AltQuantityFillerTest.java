package com.flagship.stock_ledger.reconciliation;

import com.flagship.stock_ledger.catalog.Item;
import com.flagship.stock_ledger.matching.NameMatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AltQuantityFillerTest {

    @Mock
    private NameMatcher nameMatcher;

    @InjectMocks
    private AltQuantityFiller filler;

    private static Item item(String factor) {
        return Item.create(UUID.randomUUID(), "Oil", "litre", "can", factor, BigDecimal.ONE);
    }

    @Test
    @DisplayName("A non-zero submitted value is kept verbatim")
    void testKeepsSubmittedValue() {
        assertEquals("50 box", filler.fill("Oil", new BigDecimal("10"), "50 box"));
        assertEquals("7", filler.fill("Oil", new BigDecimal("10"), " 7 "));

        verify(nameMatcher, never()).findItemByName(anyString());
    }

    @Test
    @DisplayName("Missing value is derived from a numeric factor")
    void testDerivesFromFactor() {
        when(nameMatcher.findItemByName("Oil")).thenReturn(Optional.of(item("5")));

        assertEquals("50", filler.fill("Oil", new BigDecimal("10"), null));
    }

    @Test
    @DisplayName("Zero and placeholder values are treated as missing")
    void testZeroAndPlaceholderAreFilled() {
        when(nameMatcher.findItemByName("Oil")).thenReturn(Optional.of(item("2.5")));

        assertEquals("10", filler.fill("Oil", new BigDecimal("4"), "0"));
        assertEquals("10", filler.fill("Oil", new BigDecimal("4"), "-"));
        assertEquals("10", filler.fill("Oil", new BigDecimal("4"), ""));
    }

    @Test
    @DisplayName("Manual factor falls back to zero")
    void testManualFactor() {
        when(nameMatcher.findItemByName("Oil")).thenReturn(Optional.of(item("Manual")));

        assertEquals("0", filler.fill("Oil", new BigDecimal("10"), null));
    }

    @Test
    @DisplayName("Unknown item falls back to zero")
    void testUnknownItem() {
        when(nameMatcher.findItemByName("Ghost")).thenReturn(Optional.empty());

        assertEquals("0", filler.fill("Ghost", new BigDecimal("10"), null));
    }

    @Test
    @DisplayName("Factor with an oversized exponent counts as no factor")
    void testOversizedFactor() {
        when(nameMatcher.findItemByName("Oil")).thenReturn(Optional.of(item("1e999999999")));

        assertEquals("0", filler.fill("Oil", new BigDecimal("10"), null));
    }

    @Test
    @DisplayName("Derived value beyond the supported range is stored as 0")
    void testDerivedValueOutOfRange() {
        when(nameMatcher.findItemByName("Oil")).thenReturn(Optional.of(item("1000")));

        assertEquals("0", filler.fill("Oil", new BigDecimal("999999999999999"), null));
    }

    @Test
    @DisplayName("Oversized submitted value is not kept")
    void testOversizedSubmittedValue() {
        when(nameMatcher.findItemByName("Oil")).thenReturn(Optional.of(item("5")));

        assertEquals("50", filler.fill("Oil", new BigDecimal("10"), "1e999999999"));
    }
}
