package com.flagship.stock_ledger.ledger;

import com.flagship.stock_ledger.ledger.dto.TransactionRequest;
import com.flagship.stock_ledger.ledger.dto.TransactionResponse;
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
 * REST controller for stock movements.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final LedgerService ledgerService;

    @GetMapping
    public ResponseEntity<List<TransactionResponse>> listTransactions() {
        List<TransactionResponse> transactions = ledgerService.listTransactions()
            .stream()
            .map(TransactionResponse::from)
            .toList();
        return ResponseEntity.ok(transactions);
    }

    @PostMapping
    public ResponseEntity<TransactionResponse> createTransaction(@Valid @RequestBody TransactionRequest request) {
        log.info("Received transaction: item='{}', type={}, quantity={}",
                request.getItemName(), request.getType(), request.getQuantity());

        StockTransaction saved = ledgerService.recordTransaction(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(saved));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TransactionResponse> updateTransaction(@PathVariable("id") UUID id,
                                                                 @Valid @RequestBody TransactionRequest request) {
        StockTransaction saved = ledgerService.updateTransaction(id, request);
        return ResponseEntity.ok(TransactionResponse.from(saved));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteTransaction(@PathVariable("id") UUID id) {
        ledgerService.deleteTransaction(id);
        return ResponseEntity.ok(Map.of("message", "Deleted"));
    }
}
