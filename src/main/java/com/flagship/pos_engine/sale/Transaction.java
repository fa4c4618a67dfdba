package com.flagship.pos_engine.sale;

import com.flagship.pos_engine.pricing.Money;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Receipt header with running totals.
 *
 * Invariants:
 * - total equals the sum of the subtotals of its line items
 * - lineItemCount is null until the first line succeeds, then equals the number of lines
 * - once completedAt is set no further lines are accepted
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Transaction {
    UUID id;
    UUID merchantId;
    Integer lineItemCount;
    BigDecimal total;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;

    /**
     * Opens an empty transaction at the start of a checkout.
     */
    public static Transaction open(UUID merchantId) {
        if (merchantId == null) {
            throw new IllegalArgumentException("Merchant ID is required");
        }
        Instant now = Instant.now();
        return new Transaction(UUID.randomUUID(), merchantId, null, Money.ZERO, now, now, null);
    }

    public static Transaction restore(UUID id, UUID merchantId, Integer lineItemCount, BigDecimal total,
                                      Instant createdAt, Instant updatedAt, Instant completedAt) {
        return new Transaction(id, merchantId, lineItemCount, Money.normalize(total), createdAt, updatedAt,
            completedAt);
    }

    /**
     * Accounts for one more successful line.
     *
     * @return New Transaction with the subtotal added and the line count incremented
     */
    public Transaction addLine(BigDecimal subtotal) {
        if (isCompleted()) {
            throw new IllegalStateException("Transaction " + id + " is completed and accepts no more lines");
        }
        if (subtotal == null || subtotal.signum() < 0) {
            throw new IllegalArgumentException("Line subtotal must be zero or positive");
        }
        int count = lineItemCount == null ? 1 : lineItemCount + 1;
        return new Transaction(id, merchantId, count, Money.add(total, subtotal), createdAt, Instant.now(), null);
    }

    /**
     * Closes the transaction. Completing an already completed transaction returns it unchanged.
     */
    public Transaction complete() {
        if (isCompleted()) {
            return this;
        }
        Instant now = Instant.now();
        return new Transaction(id, merchantId, lineItemCount, total, createdAt, now, now);
    }

    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean hasLines() {
        return lineItemCount != null && lineItemCount > 0;
    }
}
