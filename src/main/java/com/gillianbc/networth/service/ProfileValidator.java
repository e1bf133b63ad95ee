package com.gillianbc.networth.service;

import com.gillianbc.networth.model.FinancialProfile;
import com.gillianbc.networth.model.InvalidProjectionInputException;
import com.gillianbc.networth.model.ScenarioCategory;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Input checks run before any projection starts.
 */
public final class ProfileValidator {

    private ProfileValidator() {
    }

    /**
     * @throws InvalidProjectionInputException if income is not positive, or any expense,
     *                                         savings or debt amount is negative
     */
    public static void validateProfile(FinancialProfile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        if (profile.getMonthlyIncome().signum() <= 0) {
            throw new InvalidProjectionInputException("monthlyIncome must be > 0");
        }
        for (ScenarioCategory category : ScenarioCategory.values()) {
            if (category.isExpense() && profile.getMonthlyExpenses().get(category).signum() < 0) {
                throw new InvalidProjectionInputException(category.wireName() + " expenses must be >= 0");
            }
        }
        requireNonNegative(profile.getCurrentSavings(), "currentSavings");
        requireNonNegative(profile.getCurrentDebt(), "currentDebt");
    }

    public static void validateMonths(int months) {
        if (months < 1) {
            throw new InvalidProjectionInputException("months must be >= 1");
        }
    }

    private static void requireNonNegative(BigDecimal value, String name) {
        if (value.signum() < 0) {
            throw new InvalidProjectionInputException(name + " must be >= 0");
        }
    }
}
