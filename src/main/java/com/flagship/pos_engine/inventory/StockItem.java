package com.flagship.pos_engine.inventory;

import com.flagship.pos_engine.pricing.InconsistentPricingException;
import com.flagship.pos_engine.pricing.Money;
import com.flagship.pos_engine.pricing.StockPricing;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A priced inventory record owned by one merchant.
 *
 * Key principles:
 * - Immutable: every change returns a new StockItem
 * - Derived pricing is recomputed on every change of quantity, price or margin
 * - Quantity on hand is never negative
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StockItem {
    UUID id;
    UUID merchantId;
    String name;
    int quantityOnHand;
    int unitSize;
    BigDecimal purchaseUnitPrice;
    int profitMarginPercent;
    StockPricing pricing;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new stock item from raw purchase data.
     * Input validation is the caller's job (see StockService).
     */
    public static StockItem register(UUID merchantId, NewStockItem input) {
        Instant now = Instant.now();
        BigDecimal price = Money.normalize(input.getPurchaseUnitPrice());
        return new StockItem(
            UUID.randomUUID(),
            merchantId,
            input.getName(),
            input.getQuantityOnHand(),
            input.getUnitSize(),
            price,
            input.getProfitMarginPercent(),
            StockPricing.recompute(input.getQuantityOnHand(), price, input.getProfitMarginPercent()),
            now,
            now
        );
    }

    /**
     * Rebuilds a stock item read back from storage.
     *
     * @throws InconsistentPricingException if the stored derived fields disagree
     *         with the stored raw inputs
     */
    public static StockItem restore(UUID id, UUID merchantId, String name, int quantityOnHand, int unitSize,
                                    BigDecimal purchaseUnitPrice, int profitMarginPercent,
                                    StockPricing storedPricing, Instant createdAt, Instant updatedAt) {
        StockPricing expected = StockPricing.recompute(quantityOnHand, purchaseUnitPrice, profitMarginPercent);
        if (!expected.sameAmountsAs(storedPricing)) {
            throw new InconsistentPricingException(id, storedPricing, expected);
        }
        return new StockItem(id, merchantId, name, quantityOnHand, unitSize,
            Money.normalize(purchaseUnitPrice), profitMarginPercent, expected, createdAt, updatedAt);
    }

    /**
     * Returns a copy with a new quantity and recomputed pricing.
     */
    public StockItem withQuantityOnHand(int newQuantity) {
        if (newQuantity < 0) {
            throw new IllegalArgumentException(
                String.format("Stock item %s cannot go below zero (requested %d)", id, newQuantity));
        }
        return new StockItem(id, merchantId, name, newQuantity, unitSize, purchaseUnitPrice,
            profitMarginPercent, StockPricing.recompute(newQuantity, purchaseUnitPrice, profitMarginPercent),
            createdAt, Instant.now());
    }

    public StockItem restock(int additionalQuantity) {
        if (additionalQuantity <= 0) {
            throw new IllegalArgumentException("Restock quantity must be positive");
        }
        return withQuantityOnHand(Math.addExact(quantityOnHand, additionalQuantity));
    }

    public StockItem reprice(BigDecimal newPurchaseUnitPrice, int newProfitMarginPercent) {
        BigDecimal price = Money.normalize(newPurchaseUnitPrice);
        return new StockItem(id, merchantId, name, quantityOnHand, unitSize, price, newProfitMarginPercent,
            StockPricing.recompute(quantityOnHand, price, newProfitMarginPercent), createdAt, Instant.now());
    }

    public BigDecimal getSaleUnitPrice() {
        return pricing.getSaleUnitPrice();
    }
}
