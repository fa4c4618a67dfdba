package com.flagship.pos_engine.pricing;

import java.util.UUID;

/**
 * Stored derived pricing fields do not match what the raw inputs produce.
 *
 * Infrastructure failure, not a business outcome: the row is corrupt and
 * nothing may be sold from it until it is repaired.
 */
public class InconsistentPricingException extends IllegalStateException {

    private final UUID stockItemId;

    public InconsistentPricingException(UUID stockItemId, StockPricing stored, StockPricing expected) {
        super(String.format("Stock item %s has inconsistent pricing: stored=%s, expected=%s",
            stockItemId, stored, expected));
        this.stockItemId = stockItemId;
    }

    public UUID getStockItemId() {
        return stockItemId;
    }
}
