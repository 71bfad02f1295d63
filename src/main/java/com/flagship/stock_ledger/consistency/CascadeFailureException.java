package com.flagship.stock_ledger.consistency;

import lombok.Getter;

import java.util.UUID;

/**
 * One side of a catalog change is committed but the other is not.
 *
 * RENAME: the item carries the new name, the ledger may still carry the previous
 * one until {@code POST /api/items/{id}/cascade} is called.
 * DELETE: the item's ledger rows are gone but the item itself is still in the
 * catalog; issuing the delete again completes it.
 */
@Getter
public class CascadeFailureException extends RuntimeException {

    private final UUID itemId;
    private final CascadeOperation operation;
    private final String previousName;
    private final String currentName;

    public CascadeFailureException(UUID itemId, CascadeOperation operation,
                                   String previousName, String currentName, Throwable cause) {
        super(describe(itemId, operation, cause), cause);
        this.itemId = itemId;
        this.operation = operation;
        this.previousName = previousName;
        this.currentName = currentName;
    }

    public boolean isCatalogCommitted() {
        return operation == CascadeOperation.RENAME;
    }

    public String retryRoute() {
        return switch (operation) {
            case RENAME -> "POST /api/items/" + itemId + "/cascade";
            case DELETE -> "DELETE /api/items/" + itemId;
        };
    }

    private static String describe(UUID itemId, CascadeOperation operation, Throwable cause) {
        return switch (operation) {
            case RENAME -> String.format("Item %s renamed but the ledger rewrite failed: %s",
                    itemId, cause.getMessage());
            case DELETE -> String.format("Ledger rows of item %s removed but the item delete failed: %s",
                    itemId, cause.getMessage());
        };
    }

    public enum CascadeOperation {
        RENAME,
        DELETE
    }
}
