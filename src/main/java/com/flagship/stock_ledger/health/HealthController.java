package com.flagship.stock_ledger.health;

import com.flagship.stock_ledger.catalog.ItemRepository;
import com.flagship.stock_ledger.ledger.StockTransactionRepository;
import com.flagship.stock_ledger.observability.OrphanReferenceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoints for the front end and load balancer.
 *
 * {@code /health} checks the store by counting both tables, so a response of UP means
 * the catalog and the ledger are both readable. The orphan figure is the cached one.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final ItemRepository itemRepository;
    private final StockTransactionRepository transactionRepository;
    private final OrphanReferenceMetrics orphanReferenceMetrics;

    @GetMapping("/")
    public String banner() {
        return "Stock ledger backend is running";
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());

        try {
            long items = itemRepository.count();
            long transactions = transactionRepository.count();

            body.put("status", "UP");
            body.put("database", "UP");
            body.put("items", items);
            body.put("transactions", transactions);
            body.put("orphanedTransactions", orphanReferenceMetrics.getOrphanedCount());
            return ResponseEntity.ok(body);
        } catch (DataAccessException e) {
            log.warn("Store check failed: {}", e.getMessage());
            body.put("status", "DOWN");
            body.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
