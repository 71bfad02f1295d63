package com.flagship.stock_ledger.catalog;

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
 * JPA entity for catalog items.
 *
 * No setters: changes go through {@link #updateFromDomain(Item)} so the normalized
 * name index is always recomputed together with the name.
 */
@Entity
@Table(
    name = "items",
    indexes = {
        @Index(name = "idx_items_normalized_name", columnList = "normalized_name")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    @Column(nullable = false)
    private String unit;

    @Column(name = "alt_unit", nullable = false)
    private String altUnit;

    @Column(nullable = false)
    private String factor;

    @Column(name = "alert_qty", nullable = false, precision = 19, scale = 4)
    private BigDecimal alertQty;

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

    static ItemEntity fromDomain(Item item) {
        return new ItemEntity(
            item.getId(),
            item.getName(),
            NameMatcher.normalize(item.getName()),
            item.getUnit(),
            item.getAltUnit(),
            item.getFactor(),
            item.getAlertQty(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Item toDomain() {
        return new Item(id, name, unit, altUnit, factor, alertQty, createdAt, updatedAt);
    }

    void updateFromDomain(Item item) {
        this.name = item.getName();
        this.normalizedName = NameMatcher.normalize(item.getName());
        this.unit = item.getUnit();
        this.altUnit = item.getAltUnit();
        this.factor = item.getFactor();
        this.alertQty = item.getAlertQty();
    }
}
