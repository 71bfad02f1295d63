package com.flagship.stock_ledger.reconciliation;

import com.flagship.stock_ledger.catalog.Item;
import com.flagship.stock_ledger.matching.NameMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Write-time fill of a transaction's alternate quantity.
 *
 * Rules, in order:
 * 1. a submitted value that parses to a non-zero number is kept verbatim;
 * 2. otherwise, if the named item has a numeric factor, quantity x factor is stored;
 * 3. otherwise "0" is stored.
 *
 * A derived figure outside the parser's range is stored as "0" as well, so the
 * read path never meets a value it would discard.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AltQuantityFiller {

    private final NameMatcher nameMatcher;

    public String fill(String itemName, BigDecimal quantity, String submittedAltQty) {
        if (QuantityParser.toQuantity(submittedAltQty).signum() != 0) {
            return submittedAltQty.strip();
        }

        ConversionFactor factor = nameMatcher.findItemByName(itemName)
            .map(Item::conversionFactor)
            .orElse(ConversionFactor.parse(null));

        if (!factor.isNumeric()) {
            log.debug("No numeric factor for item '{}', alternate quantity defaults to 0", itemName);
            return "0";
        }

        BigDecimal product = factor.convert(quantity);
        String derived = QuantityParser.bound(product)
            .map(QuantityParser::format)
            .orElse(null);
        if (derived == null) {
            log.warn("Derived alternate quantity out of range for item '{}' (quantity={}, factor={}), storing 0",
                    itemName, quantity, factor);
            return "0";
        }
        log.debug("Derived alternate quantity {} for item '{}' (factor={})", derived, itemName, factor);
        return derived;
    }
}
