package com.flagship.stock_ledger.catalog;

import com.flagship.stock_ledger.catalog.dto.CascadeResult;
import com.flagship.stock_ledger.catalog.dto.CascadeRetryRequest;
import com.flagship.stock_ledger.catalog.dto.ItemRequest;
import com.flagship.stock_ledger.catalog.dto.ItemResponse;
import com.flagship.stock_ledger.reconciliation.ItemStock;
import com.flagship.stock_ledger.reconciliation.StockQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for the item catalog.
 *
 * Quantities in responses are derived from the ledger on every read; nothing
 * about stock is stored on the item.
 */
@RestController
@RequestMapping("/api/items")
@RequiredArgsConstructor
@Slf4j
public class ItemController {

    private final CatalogService catalogService;
    private final StockQueryService stockQueryService;

    @GetMapping
    public ResponseEntity<List<ItemResponse>> listItems() {
        List<ItemResponse> items = stockQueryService.listItemStock()
            .stream()
            .map(ItemResponse::from)
            .toList();
        return ResponseEntity.ok(items);
    }

    /**
     * Creates an item. A new item has no history, so its quantities are zero.
     */
    @PostMapping
    public ResponseEntity<ItemResponse> createItem(@Valid @RequestBody ItemRequest request) {
        log.info("Received item creation request: name='{}'", request.getName());

        Item item = catalogService.createItem(
            request.getName(),
            request.getUnit(),
            request.getAltUnit(),
            request.getFactor(),
            request.getAlertQty()
        );

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ItemResponse.from(ItemStock.withoutHistory(item)));
    }

    /**
     * Updates an item; a changed name is cascaded into the ledger.
     */
    @PutMapping("/{id}")
    public ResponseEntity<ItemResponse> updateItem(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody ItemRequest request) {
        Item item = catalogService.updateItem(
            id,
            request.getName(),
            request.getUnit(),
            request.getAltUnit(),
            request.getFactor(),
            request.getAlertQty()
        );
        return ResponseEntity.ok(ItemResponse.from(stockQueryService.stockOf(item)));
    }

    @PostMapping("/{id}/cascade")
    public ResponseEntity<CascadeResult> retryCascade(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody CascadeRetryRequest request) {
        int rewritten = catalogService.retryRenameCascade(id, request.getPreviousName());
        return ResponseEntity.ok(new CascadeResult("Cascade complete", rewritten));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteItem(@PathVariable("id") UUID id) {
        catalogService.deleteItem(id);
        return ResponseEntity.ok(Map.of("message", "Deleted"));
    }
}
