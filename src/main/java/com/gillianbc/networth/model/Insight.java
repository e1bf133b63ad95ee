package com.gillianbc.networth.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured result of comparing a what-if timeline against the status quo.
 * The amount is present for the monetary insights (net worth and savings deltas).
 */
@Getter
@EqualsAndHashCode
@ToString
public class Insight {

    private final InsightType type;
    @Getter(AccessLevel.NONE)
    private final BigDecimal amount;
    private final String message;

    public Insight(InsightType type, BigDecimal amount, String message) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.amount = amount;
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public Optional<BigDecimal> getAmount() {
        return Optional.ofNullable(amount);
    }
}
