package com.flagship.pos_engine.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Raw purchase data a merchant enters when registering stock.
 */
@Value
@Builder
public class NewStockItem {
    String name;
    int quantityOnHand;
    @Builder.Default
    int unitSize = 1;
    BigDecimal purchaseUnitPrice;
    int profitMarginPercent;
}
