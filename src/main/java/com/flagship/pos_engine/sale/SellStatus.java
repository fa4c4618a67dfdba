package com.flagship.pos_engine.sale;

/**
 * Result of one sell call. Every status except SUCCESS guarantees that
 * nothing was written.
 */
public enum SellStatus {
    /**
     * Line item created, stock decremented (or depleted and deleted), totals updated.
     */
    SUCCESS,

    /**
     * Requested quantity was zero or negative. Checked before storage is touched.
     */
    INVALID_QUANTITY,

    /**
     * Transaction does not exist within the merchant scope.
     */
    TRANSACTION_NOT_FOUND,

    /**
     * Transaction was already completed and accepts no more lines.
     */
    TRANSACTION_CLOSED,

    /**
     * Stock item does not exist within the merchant scope (stale or foreign reference).
     */
    ITEM_NOT_FOUND,

    /**
     * Requested quantity exceeds quantity on hand.
     */
    INSUFFICIENT_STOCK,

    /**
     * The stock item lock could not be acquired in time. Safe to retry.
     */
    CONCURRENCY_CONFLICT;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
