package com.gillianbc.networth.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable household snapshot fed into a projection.
 * Modifications always go through the {@code with...} methods, which return a new profile.
 */
@Getter
@EqualsAndHashCode
@ToString
public class FinancialProfile {

    private final BigDecimal monthlyIncome;
    private final MonthlyExpenses monthlyExpenses;
    private final BigDecimal currentSavings;
    private final BigDecimal currentDebt;
    /**
     * Optional target the household is saving towards; may be null.
     */
    @Getter(AccessLevel.NONE)
    private final BigDecimal savingsGoal;

    public FinancialProfile(BigDecimal monthlyIncome,
                            MonthlyExpenses monthlyExpenses,
                            BigDecimal currentSavings,
                            BigDecimal currentDebt) {
        this(monthlyIncome, monthlyExpenses, currentSavings, currentDebt, null);
    }

    /**
     * Explicit constructor with parameter order:
     * (monthlyIncome, monthlyExpenses, currentSavings, currentDebt, savingsGoal)
     */
    public FinancialProfile(BigDecimal monthlyIncome,
                            MonthlyExpenses monthlyExpenses,
                            BigDecimal currentSavings,
                            BigDecimal currentDebt,
                            BigDecimal savingsGoal) {
        this.monthlyIncome = Objects.requireNonNull(monthlyIncome, "monthlyIncome must not be null");
        this.monthlyExpenses = Objects.requireNonNull(monthlyExpenses, "monthlyExpenses must not be null");
        this.currentSavings = Objects.requireNonNull(currentSavings, "currentSavings must not be null");
        this.currentDebt = Objects.requireNonNull(currentDebt, "currentDebt must not be null");
        this.savingsGoal = savingsGoal;
    }

    public Optional<BigDecimal> getSavingsGoal() {
        return Optional.ofNullable(savingsGoal);
    }

    public BigDecimal totalMonthlyExpenses() {
        return monthlyExpenses.total();
    }

    public FinancialProfile withMonthlyIncome(BigDecimal income) {
        return new FinancialProfile(income, monthlyExpenses, currentSavings, currentDebt, savingsGoal);
    }

    public FinancialProfile withMonthlyExpenses(MonthlyExpenses expenses) {
        return new FinancialProfile(monthlyIncome, expenses, currentSavings, currentDebt, savingsGoal);
    }

    public FinancialProfile withCurrentSavings(BigDecimal savings) {
        return new FinancialProfile(monthlyIncome, monthlyExpenses, savings, currentDebt, savingsGoal);
    }

    public FinancialProfile withCurrentDebt(BigDecimal debt) {
        return new FinancialProfile(monthlyIncome, monthlyExpenses, currentSavings, debt, savingsGoal);
    }
}
