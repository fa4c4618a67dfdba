package com.flagship.pos_engine.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point currency arithmetic.
 *
 * All amounts handed out by this class carry scale 2 and are rounded HALF_UP.
 * Rounding happens once, at the end of a computation, never on intermediate values.
 * Quantities are plain ints.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, ROUNDING);

    private Money() {
        // Utility class
    }

    public static BigDecimal of(String amount) {
        return normalize(new BigDecimal(amount));
    }

    public static BigDecimal of(long amount) {
        return normalize(BigDecimal.valueOf(amount));
    }

    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    /**
     * Price times quantity, e.g. a purchase total or a line subtotal.
     */
    public static BigDecimal multiply(BigDecimal unitPrice, int quantity) {
        return normalize(unitPrice.multiply(BigDecimal.valueOf(quantity)));
    }

    /**
     * Returns {@code percent / 100 * amount}, unrounded.
     */
    public static BigDecimal percentOf(BigDecimal amount, int percent) {
        return amount.multiply(BigDecimal.valueOf(percent)).movePointLeft(2);
    }

    /**
     * Returns {@code amount * (1 + percent / 100)}.
     */
    public static BigDecimal withMarkup(BigDecimal amount, int percent) {
        return normalize(amount.add(percentOf(amount, percent)));
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return normalize(left.add(right));
    }

    public static boolean sameAmount(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.compareTo(right) == 0;
    }
}
