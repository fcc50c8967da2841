package com.apex.ledger.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point helpers for every money boundary in the ledger.
 * Amounts carry {@link #SCALE} decimals; ratios carry {@link #RATIO_SCALE}.
 */
public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final int RATIO_SCALE = 8;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, ROUNDING);

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal bd(long value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return scale(scale(left).multiply(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, long right) {
        return scale(scale(left).multiply(BigDecimal.valueOf(right)));
    }

    public static BigDecimal divide(BigDecimal dividend, long divisor) {
        return scale(dividend).divide(BigDecimal.valueOf(divisor), SCALE, ROUNDING);
    }

    /**
     * Dimensionless quotient of two amounts, e.g. position value over equity.
     * Returns zero when the denominator is zero.
     */
    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE, ROUNDING);
        }
        return scale(numerator).divide(scale(denominator), RATIO_SCALE, ROUNDING);
    }

    public static BigDecimal max(BigDecimal left, BigDecimal right) {
        return scale(left).compareTo(scale(right)) >= 0 ? scale(left) : scale(right);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static String format(BigDecimal value) {
        return String.format("%,.2f", scale(value));
    }

    public static String formatPercent(BigDecimal ratio) {
        return String.format("%.2f%%", ratio.movePointRight(2));
    }
}
