package com.flagship.pos_engine.sale;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One sold quantity of one product, frozen at the time of sale.
 *
 * The product name and unit price are snapshots, so the line survives
 * deletion of the stock item it was sold from.
 */
@Value
public class TransactionLineItem {
    UUID id;
    UUID transactionId;
    String productName;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal subtotal;
    Instant createdAt;

    public static TransactionLineItem create(UUID transactionId, String productName, int quantity,
                                             BigDecimal unitPrice, BigDecimal subtotal) {
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction ID is required");
        }
        return new TransactionLineItem(UUID.randomUUID(), transactionId, productName, quantity,
            unitPrice, subtotal, Instant.now());
    }
}
