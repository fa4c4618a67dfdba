package com.flagship.pos_engine.inventory;

import java.util.UUID;

public class StockItemNotFoundException extends IllegalArgumentException {

    public StockItemNotFoundException(UUID merchantId, UUID stockItemId) {
        super("Stock item not found: " + stockItemId + " (merchant " + merchantId + ")");
    }
}
