package com.gillianbc.networth.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Arithmetic settings shared by every projection.
 */
public final class Amounts {

    public static final MathContext MATH_CONTEXT = new MathContext(12, RoundingMode.HALF_UP);
    public static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Amounts() {
    }

    /**
     * @param annualRate annual rate as a fraction, e.g. 0.05 for 5%
     * @return the simple monthly share of the annual rate
     */
    public static BigDecimal monthly(BigDecimal annualRate) {
        return annualRate.divide(MONTHS_PER_YEAR, MATH_CONTEXT);
    }

    /**
     * @return {@code amount * (1 + rate)}
     */
    public static BigDecimal grow(BigDecimal amount, BigDecimal rate) {
        return amount.multiply(BigDecimal.ONE.add(rate, MATH_CONTEXT), MATH_CONTEXT);
    }

    public static BigDecimal positivePart(BigDecimal amount) {
        return amount.signum() > 0 ? amount : BigDecimal.ZERO;
    }
}
