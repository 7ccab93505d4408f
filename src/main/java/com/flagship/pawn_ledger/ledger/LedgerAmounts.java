package com.flagship.pawn_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money handling shared by every ledger computation.
 *
 * Amounts are fixed-point with two decimals. Two amounts are considered equal
 * when they differ by less than {@link #TOLERANCE}; nothing compares money with
 * {@code equals}.
 */
public final class LedgerAmounts {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal TOLERANCE = new BigDecimal("0.01");
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private LedgerAmounts() {
    }

    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    public static boolean sameAmount(BigDecimal a, BigDecimal b) {
        return normalize(a).subtract(normalize(b)).abs().compareTo(TOLERANCE) < 0;
    }

    public static boolean isZero(BigDecimal amount) {
        return sameAmount(amount, ZERO);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    public static BigDecimal nonNegative(BigDecimal amount) {
        return amount.signum() < 0 ? ZERO : normalize(amount);
    }

    /**
     * {@code base × ratePercent / 100}, rounded to the ledger scale.
     */
    public static BigDecimal percentOf(BigDecimal base, BigDecimal ratePercent) {
        return base.multiply(ratePercent).divide(HUNDRED, SCALE, ROUNDING);
    }
}
