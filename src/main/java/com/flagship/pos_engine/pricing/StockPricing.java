package com.flagship.pos_engine.pricing;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived pricing fields of a stock item.
 *
 * Never set independently: new values come from
 * {@link #recompute(int, BigDecimal, int)}. {@link #stored} only wraps values read
 * back from storage so they can be checked against a recomputation.
 *
 * <ul>
 *   <li>purchaseTotal = quantityOnHand * purchaseUnitPrice</li>
 *   <li>saleUnitPrice = purchaseUnitPrice * (1 + margin / 100)</li>
 *   <li>saleTotal = purchaseTotal + margin / 100 * purchaseTotal</li>
 * </ul>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StockPricing {
    BigDecimal purchaseTotal;
    BigDecimal saleUnitPrice;
    BigDecimal saleTotal;

    /**
     * Computes the derived fields. Pure function.
     *
     * @param quantityOnHand units in stock, never negative
     * @param purchaseUnitPrice purchase price of one unit, never negative
     * @param profitMarginPercent markup in percent, unrestricted
     * @return freshly computed pricing
     * @throws IllegalArgumentException if quantity or price are out of range
     */
    public static StockPricing recompute(int quantityOnHand, BigDecimal purchaseUnitPrice, int profitMarginPercent) {
        if (quantityOnHand < 0) {
            throw new IllegalArgumentException("Quantity on hand cannot be negative: " + quantityOnHand);
        }
        if (purchaseUnitPrice == null) {
            throw new IllegalArgumentException("Purchase unit price is required");
        }
        if (purchaseUnitPrice.signum() < 0) {
            throw new IllegalArgumentException("Purchase unit price cannot be negative: " + purchaseUnitPrice);
        }

        BigDecimal purchaseTotal = purchaseUnitPrice.multiply(BigDecimal.valueOf(quantityOnHand));
        BigDecimal saleUnitPrice = Money.withMarkup(purchaseUnitPrice, profitMarginPercent);
        BigDecimal saleTotal = Money.normalize(
            purchaseTotal.add(Money.percentOf(purchaseTotal, profitMarginPercent)));

        return new StockPricing(Money.normalize(purchaseTotal), saleUnitPrice, saleTotal);
    }

    public static StockPricing stored(BigDecimal purchaseTotal, BigDecimal saleUnitPrice, BigDecimal saleTotal) {
        return new StockPricing(purchaseTotal, saleUnitPrice, saleTotal);
    }

    /**
     * Compares amounts numerically, ignoring scale.
     */
    public boolean sameAmountsAs(StockPricing other) {
        return other != null
            && Money.sameAmount(purchaseTotal, other.purchaseTotal)
            && Money.sameAmount(saleUnitPrice, other.saleUnitPrice)
            && Money.sameAmount(saleTotal, other.saleTotal);
    }
}
