package com.flagship.stock_ledger.ledger;

import com.flagship.stock_ledger.matching.NameMatcher;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for ledger rows.
 *
 * The item link is the {@code item_name} text. {@code normalized_item_name} is the
 * indexed lookup key and is recomputed whenever the name changes.
 */
@Entity
@Table(
    name = "stock_transactions",
    indexes = {
        @Index(name = "idx_stock_transactions_normalized_item_name", columnList = "normalized_item_name"),
        @Index(name = "idx_stock_transactions_item_name", columnList = "item_name"),
        @Index(name = "idx_stock_transactions_txn_date", columnList = "txn_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StockTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "txn_date", nullable = false)
    private String date;

    @Enumerated(EnumType.STRING)
    @Column(name = "movement_type", nullable = false, length = 3)
    private MovementType type;

    @Column(name = "item_name", nullable = false)
    private String itemName;

    @Column(name = "normalized_item_name", nullable = false)
    private String normalizedItemName;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(name = "alt_qty", nullable = false)
    private String altQty;

    @Column(length = 1000)
    private String remarks;

    private String unit;

    @Column(name = "alt_unit")
    private String altUnit;

    @Column(precision = 19, scale = 4)
    private BigDecimal rate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static StockTransactionEntity fromDomain(StockTransaction transaction) {
        return new StockTransactionEntity(
            transaction.getId(),
            transaction.getDate(),
            transaction.getType(),
            transaction.getItemName(),
            NameMatcher.normalize(transaction.getItemName()),
            transaction.getQuantity(),
            transaction.getAltQty(),
            transaction.getRemarks(),
            transaction.getUnit(),
            transaction.getAltUnit(),
            transaction.getRate(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public StockTransaction toDomain() {
        return new StockTransaction(
            id,
            date,
            type,
            itemName,
            quantity,
            altQty,
            remarks,
            unit,
            altUnit,
            rate,
            createdAt,
            updatedAt
        );
    }

    /**
     * Replaces the editable fields. Identity and creation time are immutable.
     */
    void updateFromDomain(StockTransaction transaction) {
        this.date = transaction.getDate();
        this.type = transaction.getType();
        this.itemName = transaction.getItemName();
        this.normalizedItemName = NameMatcher.normalize(transaction.getItemName());
        this.quantity = transaction.getQuantity();
        this.altQty = transaction.getAltQty();
        this.remarks = transaction.getRemarks();
        this.unit = transaction.getUnit();
        this.altUnit = transaction.getAltUnit();
        this.rate = transaction.getRate();
    }
}
