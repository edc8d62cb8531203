package com.letably.reporting.generator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding rules shared by the reports: amounts to pence, rates to whole percent, both
 * {@link RoundingMode#HALF_UP}.
 */
public final class Money {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
        // utility class
    }

    /** Amount at scale 2; {@code null} reads as zero. */
    public static BigDecimal amount(BigDecimal value) {
        return (value == null ? BigDecimal.ZERO : value).setScale(2, RoundingMode.HALF_UP);
    }

    /** {@code part / whole} in whole percent; zero when {@code whole} is zero. */
    public static int percent(long part, long whole) {
        if (whole <= 0) {
            return 0;
        }
        return percent(BigDecimal.valueOf(part), BigDecimal.valueOf(whole));
    }

    /** {@code part / whole} in whole percent; zero when {@code whole} is zero or missing. */
    public static int percent(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() <= 0) {
            return 0;
        }
        BigDecimal numerator = part == null ? BigDecimal.ZERO : part;
        return numerator.multiply(HUNDRED).divide(whole, 0, RoundingMode.HALF_UP).intValue();
    }
}
