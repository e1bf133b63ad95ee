package com.gillianbc.networth.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An income-growth event scheduled for a given month of a projection.
 * The salary increase is permanent from that month on; the bonus is a one-off
 * payment expressed as a fraction of annual income.
 */
@Getter
@EqualsAndHashCode
@ToString
public class PromotionEvent {

    private final int month;
    private final BigDecimal salaryIncreaseFraction;
    private final BigDecimal bonusFraction;
    private final PromotionKind kind;

    public PromotionEvent(int month, BigDecimal salaryIncreaseFraction, BigDecimal bonusFraction, PromotionKind kind) {
        if (month < 1) {
            throw new IllegalArgumentException("month must be >= 1");
        }
        this.month = month;
        this.salaryIncreaseFraction = Objects.requireNonNull(salaryIncreaseFraction, "salaryIncreaseFraction must not be null");
        this.bonusFraction = Objects.requireNonNull(bonusFraction, "bonusFraction must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }
}
