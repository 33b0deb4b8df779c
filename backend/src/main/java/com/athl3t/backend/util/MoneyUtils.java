package com.athl3t.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 2;
    public static final int PRICE_SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);

    private MoneyUtils() {
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Unit prices, odds and cost basis keep four decimals; cash amounts keep two.
     */
    public static BigDecimal price(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        }
        return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return scale(left.multiply(right));
    }

    public static BigDecimal multiply(BigDecimal left, int right) {
        return scale(left.multiply(BigDecimal.valueOf(right)));
    }

    public static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
