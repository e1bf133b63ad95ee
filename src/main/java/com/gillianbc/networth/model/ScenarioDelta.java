package com.gillianbc.networth.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A single what-if adjustment to one category: either a percentage change
 * ({@code value *= 1 + pct/100}) or an absolute change ({@code value += amount}), never both.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ScenarioDelta {

    private final ScenarioCategory category;
    private final BigDecimal changePercent;
    private final BigDecimal changeAmount;

    public ScenarioDelta(ScenarioCategory category, BigDecimal changePercent, BigDecimal changeAmount) {
        this.category = Objects.requireNonNull(category, "category must not be null");
        if ((changePercent == null) == (changeAmount == null)) {
            throw new InvalidProjectionInputException(
                    "Scenario delta for " + category.wireName() + " must set exactly one of changePercent or changeAmount");
        }
        this.changePercent = changePercent;
        this.changeAmount = changeAmount;
    }

    public static ScenarioDelta percent(ScenarioCategory category, BigDecimal changePercent) {
        return new ScenarioDelta(category, Objects.requireNonNull(changePercent, "changePercent must not be null"), null);
    }

    public static ScenarioDelta amount(ScenarioCategory category, BigDecimal changeAmount) {
        return new ScenarioDelta(category, null, Objects.requireNonNull(changeAmount, "changeAmount must not be null"));
    }

    public boolean isPercent() {
        return changePercent != null;
    }
}
