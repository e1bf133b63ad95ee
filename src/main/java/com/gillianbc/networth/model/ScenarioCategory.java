package com.gillianbc.networth.model;

import java.util.Locale;

/**
 * Targets of a scenario delta: the six expense categories plus the synthetic
 * {@code income} and {@code savings} categories.
 */
public enum ScenarioCategory {
    HOUSING(true),
    FOOD(true),
    TRANSPORTATION(true),
    ENTERTAINMENT(true),
    UTILITIES(true),
    OTHER(true),
    INCOME(false),
    SAVINGS(false);

    private final boolean expense;

    ScenarioCategory(boolean expense) {
        this.expense = expense;
    }

    public boolean isExpense() {
        return expense;
    }

    /**
     * @return the lower-case name used by callers, e.g. {@code "food"}
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScenarioCategory fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidProjectionInputException("Scenario category is required");
        }
        for (ScenarioCategory category : values()) {
            if (category.wireName().equalsIgnoreCase(name.trim())) {
                return category;
            }
        }
        throw new InvalidProjectionInputException("Unknown scenario category: " + name);
    }
}
