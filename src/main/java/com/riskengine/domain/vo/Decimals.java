package com.riskengine.domain.vo;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * BigDecimal helpers shared by every money calculation in the engine.
 *
 * <p>Multiplication and addition are exact. Division is the only inexact operation and
 * always goes through {@link #divide} with {@link MathContext#DECIMAL128}, which keeps 34
 * significant digits: far more than any threshold comparison needs.
 */
public final class Decimals {

    public static final MathContext DIVISION_CONTEXT = MathContext.DECIMAL128;

    public static final BigDecimal HUNDRED = new BigDecimal("100");

    private Decimals() {}

    /** Null-safe read of a stored numeric column; missing values count as zero. */
    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, DIVISION_CONTEXT);
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /** Fraction to percentage with two decimals: 0.12345 becomes 12.35. */
    public static BigDecimal toPercent(BigDecimal fraction) {
        return fraction.multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP);
    }

    public static String format(BigDecimal value, int scale) {
        return value.setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }
}
