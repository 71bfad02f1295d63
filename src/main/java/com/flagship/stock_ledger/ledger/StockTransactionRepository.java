package com.flagship.stock_ledger.ledger;

import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for ledger rows.
 */
@Repository
public interface StockTransactionRepository extends JpaRepository<StockTransactionEntity, UUID> {

    /**
     * Listing order: newest date first, then storage order for rows on the same date.
     */
    Sort LISTING_ORDER = Sort.by(Sort.Order.desc("date"), Sort.Order.asc("createdAt"), Sort.Order.asc("id"));

    List<StockTransactionEntity> findByNormalizedItemName(String normalizedItemName);

    long countByItemName(String itemName);

    /**
     * Rewrites the name link of every row stored under exactly {@code oldName}.
     * Running it again after success changes nothing.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE StockTransactionEntity t " +
           "SET t.itemName = :newName, t.normalizedItemName = :normalizedNewName " +
           "WHERE t.itemName = :oldName")
    int renameItemReferences(@Param("oldName") String oldName,
                             @Param("newName") String newName,
                             @Param("normalizedNewName") String normalizedNewName);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM StockTransactionEntity t WHERE t.itemName = :itemName")
    int deleteByItemNameExact(@Param("itemName") String itemName);

    /**
     * Rows whose name matches no catalog item.
     */
    @Query("SELECT COUNT(t) FROM StockTransactionEntity t WHERE NOT EXISTS " +
           "(SELECT 1 FROM ItemEntity i WHERE i.normalizedName = t.normalizedItemName)")
    long countOrphaned();
}
