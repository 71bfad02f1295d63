package com.flagship.stock_ledger.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for catalog items.
 */
@Repository
public interface ItemRepository extends JpaRepository<ItemEntity, UUID> {

    /**
     * Catalog listing order: creation time, then id for rows created in the same instant.
     */
    List<ItemEntity> findAllByOrderByCreatedAtAscIdAsc();

    Optional<ItemEntity> findFirstByNormalizedNameOrderByCreatedAtAscIdAsc(String normalizedName);
}
