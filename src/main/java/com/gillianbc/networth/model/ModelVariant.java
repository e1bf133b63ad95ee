package com.gillianbc.networth.model;

import java.util.Locale;

/**
 * The seven economic presets a projection can run under.
 * The variant only changes the assumptions (inflation, allocation, returns, debt payoff),
 * never the shape of the input profile or the output timeline.
 */
public enum ModelVariant {
    LINEAR("Linear Growth", "Steady, predictable growth"),
    EXPONENTIAL("Compound Growth", "Exponential returns over time"),
    SEASONAL("Seasonal Patterns", "Accounts for seasonal variations"),
    REALISTIC("Realistic Model", "Considers market volatility"),
    CONSERVATIVE("Conservative", "Lower risk, steady returns"),
    SAVINGS("Savings Focus", "Cash savings with modest interest"),
    OPTIMISTIC("Optimistic", "Best-case scenario projections");

    private final String displayName;
    private final String description;

    ModelVariant(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a variant from its lower-case wire name (case-insensitive).
     *
     * @throws InvalidProjectionInputException if the name does not match one of the seven variants
     */
    public static ModelVariant fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidProjectionInputException("Model variant is required");
        }
        for (ModelVariant variant : values()) {
            if (variant.wireName().equalsIgnoreCase(name.trim())) {
                return variant;
            }
        }
        throw new InvalidProjectionInputException("Unknown model variant: " + name
                + " (expected one of linear, exponential, seasonal, realistic, conservative, savings, optimistic)");
    }
}
