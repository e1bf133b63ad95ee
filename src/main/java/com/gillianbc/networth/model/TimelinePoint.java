package com.gillianbc.networth.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Immutable end-of-month snapshot of a projection.
 * Net worth is never supplied by the caller: it is always {@code savings - debt}
 * of the rounded balances, so the identity holds exactly for every point.
 */
@Getter
@EqualsAndHashCode
@ToString
public class TimelinePoint {

    private final int month;
    private final BigDecimal netWorth;
    /**
     * Cash plus investments.
     */
    private final BigDecimal savings;
    private final BigDecimal debt;
    /**
     * Cumulative spending since month 1.
     */
    private final BigDecimal totalSpent;
    /**
     * Cumulative income minus spending since month 1.
     */
    private final BigDecimal totalSaved;

    /**
     * Parameter order: (month, savings, debt, totalSpent, totalSaved).
     * All amounts are rounded HALF_UP to 2 decimal places.
     */
    public TimelinePoint(int month,
                         BigDecimal savings,
                         BigDecimal debt,
                         BigDecimal totalSpent,
                         BigDecimal totalSaved) {
        if (month < 1) {
            throw new IllegalArgumentException("month must be >= 1");
        }
        this.month = month;
        this.savings = Objects.requireNonNull(savings, "savings must not be null").setScale(2, RoundingMode.HALF_UP);
        this.debt = Objects.requireNonNull(debt, "debt must not be null").setScale(2, RoundingMode.HALF_UP);
        this.totalSpent = Objects.requireNonNull(totalSpent, "totalSpent must not be null").setScale(2, RoundingMode.HALF_UP);
        this.totalSaved = Objects.requireNonNull(totalSaved, "totalSaved must not be null").setScale(2, RoundingMode.HALF_UP);
        this.netWorth = this.savings.subtract(this.debt);
    }
}
