package com.flagship.pos_engine.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class StockPricingTest {

    @Nested
    @DisplayName("recompute")
    class Recompute {

        @Test
        @DisplayName("100 units at 3000 with 20% margin sell at 3600.00 each, 360000.00 in total")
        void typicalItem() {
            StockPricing pricing = StockPricing.recompute(100, Money.of(3000), 20);

            assertEquals(new BigDecimal("300000.00"), pricing.getPurchaseTotal());
            assertEquals(new BigDecimal("3600.00"), pricing.getSaleUnitPrice());
            assertEquals(new BigDecimal("360000.00"), pricing.getSaleTotal());
        }

        @Test
        @DisplayName("Zero margin sells at purchase price")
        void zeroMargin() {
            StockPricing pricing = StockPricing.recompute(7, Money.of("1250.50"), 0);

            assertEquals(new BigDecimal("1250.50"), pricing.getSaleUnitPrice());
            assertEquals(new BigDecimal("8753.50"), pricing.getPurchaseTotal());
            assertEquals(pricing.getPurchaseTotal(), pricing.getSaleTotal());
        }

        @Test
        @DisplayName("Margins of 100% and above are allowed")
        void largeMargins() {
            assertEquals(new BigDecimal("10000.00"),
                StockPricing.recompute(1, Money.of(5000), 100).getSaleUnitPrice());
            assertEquals(new BigDecimal("17500.00"),
                StockPricing.recompute(1, Money.of(5000), 250).getSaleUnitPrice());
        }

        @Test
        @DisplayName("Rounding is HALF_UP and applied only to the final value")
        void roundsOnceHalfUp() {
            // 0.05 * 1.15 = 0.0575 -> 0.06
            StockPricing pricing = StockPricing.recompute(3, new BigDecimal("0.05"), 15);

            assertEquals(new BigDecimal("0.06"), pricing.getSaleUnitPrice());
            // 0.15 * 1.15 = 0.1725 -> 0.17, not 3 * 0.06
            assertEquals(new BigDecimal("0.17"), pricing.getSaleTotal());
        }

        @Test
        @DisplayName("Zero quantity gives zero totals but keeps the unit price")
        void zeroQuantity() {
            StockPricing pricing = StockPricing.recompute(0, Money.of(3000), 20);

            assertEquals(Money.ZERO, pricing.getPurchaseTotal());
            assertEquals(Money.ZERO, pricing.getSaleTotal());
            assertEquals(new BigDecimal("3600.00"), pricing.getSaleUnitPrice());
        }

        @Test
        @DisplayName("All amounts carry two decimals")
        void scaleIsTwo() {
            StockPricing pricing = StockPricing.recompute(3, new BigDecimal("10"), 33);

            assertEquals(2, pricing.getPurchaseTotal().scale());
            assertEquals(2, pricing.getSaleUnitPrice().scale());
            assertEquals(2, pricing.getSaleTotal().scale());
        }

        @Test
        @DisplayName("Negative quantity, negative price and missing price are rejected")
        void rejectsInvalidInputs() {
            assertThrows(IllegalArgumentException.class, () -> StockPricing.recompute(-1, Money.of(10), 5));
            assertThrows(IllegalArgumentException.class, () -> StockPricing.recompute(1, new BigDecimal("-0.01"), 5));
            assertThrows(IllegalArgumentException.class, () -> StockPricing.recompute(1, null, 5));
        }
    }

    @Nested
    @DisplayName("sameAmountsAs")
    class SameAmounts {

        @Test
        @DisplayName("Ignores scale differences")
        void ignoresScale() {
            StockPricing stored = StockPricing.stored(
                new BigDecimal("300000"), new BigDecimal("3600.0"), new BigDecimal("360000.000"));

            assertTrue(StockPricing.recompute(100, Money.of(3000), 20).sameAmountsAs(stored));
        }

        @Test
        @DisplayName("Detects a single differing field")
        void detectsDifference() {
            StockPricing stored = StockPricing.stored(
                new BigDecimal("300000.00"), new BigDecimal("3600.00"), new BigDecimal("360000.01"));

            assertFalse(StockPricing.recompute(100, Money.of(3000), 20).sameAmountsAs(stored));
            assertFalse(StockPricing.recompute(100, Money.of(3000), 20).sameAmountsAs(null));
        }
    }
}
