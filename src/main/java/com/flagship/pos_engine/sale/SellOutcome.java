package com.flagship.pos_engine.sale;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * Typed outcome of {@link TransactionProcessor#sell}.
 *
 * lineItem is set only for SUCCESS; availableQuantity only for INSUFFICIENT_STOCK.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SellOutcome {
    SellStatus status;
    TransactionLineItem lineItem;
    Integer availableQuantity;
    String message;

    public static SellOutcome success(TransactionLineItem lineItem) {
        return new SellOutcome(SellStatus.SUCCESS, lineItem, null, null);
    }

    public static SellOutcome invalidQuantity(int requestedQuantity) {
        return new SellOutcome(SellStatus.INVALID_QUANTITY, null, null,
            "Quantity must be positive, got " + requestedQuantity);
    }

    public static SellOutcome transactionNotFound(UUID transactionId) {
        return new SellOutcome(SellStatus.TRANSACTION_NOT_FOUND, null, null,
            "Transaction not found: " + transactionId);
    }

    public static SellOutcome transactionClosed(UUID transactionId) {
        return new SellOutcome(SellStatus.TRANSACTION_CLOSED, null, null,
            "Transaction already completed: " + transactionId);
    }

    public static SellOutcome itemNotFound(UUID stockItemId) {
        return new SellOutcome(SellStatus.ITEM_NOT_FOUND, null, null,
            "Stock item not found: " + stockItemId);
    }

    public static SellOutcome insufficientStock(String productName, int requested, int available) {
        return new SellOutcome(SellStatus.INSUFFICIENT_STOCK, null, available,
            String.format("Insufficient stock for %s: requested %d, available %d", productName, requested, available));
    }

    public static SellOutcome concurrencyConflict(UUID stockItemId) {
        return new SellOutcome(SellStatus.CONCURRENCY_CONFLICT, null, null,
            "Stock item is locked by another sale, retry: " + stockItemId);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }
}
