package com.gillianbc.networth.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable set of monthly spending per expense category.
 * Sign checks happen when a profile is validated for projection, so a scenario
 * that drives a category negative can still be represented and reported.
 */
@Getter
@EqualsAndHashCode
@ToString
public class MonthlyExpenses {

    private final BigDecimal housing;
    private final BigDecimal food;
    private final BigDecimal transportation;
    private final BigDecimal entertainment;
    private final BigDecimal utilities;
    private final BigDecimal other;

    /**
     * Parameter order: (housing, food, transportation, entertainment, utilities, other)
     */
    public MonthlyExpenses(BigDecimal housing,
                           BigDecimal food,
                           BigDecimal transportation,
                           BigDecimal entertainment,
                           BigDecimal utilities,
                           BigDecimal other) {
        this.housing = Objects.requireNonNull(housing, "housing must not be null");
        this.food = Objects.requireNonNull(food, "food must not be null");
        this.transportation = Objects.requireNonNull(transportation, "transportation must not be null");
        this.entertainment = Objects.requireNonNull(entertainment, "entertainment must not be null");
        this.utilities = Objects.requireNonNull(utilities, "utilities must not be null");
        this.other = Objects.requireNonNull(other, "other must not be null");
    }

    /**
     * @return sum of all six categories
     */
    public BigDecimal total() {
        return housing.add(food).add(transportation).add(entertainment).add(utilities).add(other);
    }

    public BigDecimal get(ScenarioCategory category) {
        return switch (category) {
            case HOUSING -> housing;
            case FOOD -> food;
            case TRANSPORTATION -> transportation;
            case ENTERTAINMENT -> entertainment;
            case UTILITIES -> utilities;
            case OTHER -> other;
            default -> throw new IllegalArgumentException(category.wireName() + " is not an expense category");
        };
    }

    /**
     * @return a copy with the given category replaced
     */
    public MonthlyExpenses with(ScenarioCategory category, BigDecimal value) {
        Objects.requireNonNull(value, "value must not be null");
        return switch (category) {
            case HOUSING -> new MonthlyExpenses(value, food, transportation, entertainment, utilities, other);
            case FOOD -> new MonthlyExpenses(housing, value, transportation, entertainment, utilities, other);
            case TRANSPORTATION -> new MonthlyExpenses(housing, food, value, entertainment, utilities, other);
            case ENTERTAINMENT -> new MonthlyExpenses(housing, food, transportation, value, utilities, other);
            case UTILITIES -> new MonthlyExpenses(housing, food, transportation, entertainment, value, other);
            case OTHER -> new MonthlyExpenses(housing, food, transportation, entertainment, utilities, value);
            default -> throw new IllegalArgumentException(category.wireName() + " is not an expense category");
        };
    }
}
