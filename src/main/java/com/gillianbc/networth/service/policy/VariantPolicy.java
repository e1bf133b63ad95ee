package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.MonthContext;
import com.gillianbc.networth.service.SimulationState;

import java.math.BigDecimal;

/**
 * Economic assumptions of one {@link ModelVariant}. The projection engine owns the monthly loop
 * (promotions, inflation, surplus, totals, snapshot); a policy only decides how the surplus is
 * split, what the balances earn and how fast debt is paid.
 * <p>
 * Implementations are stateless and shared; all per-run data lives in {@link SimulationState}.
 */
public interface VariantPolicy {

    ModelVariant variant();

    /**
     * Annual inflation applied to expenses, compounded monthly from month 1.
     */
    BigDecimal annualInflation();

    /**
     * Annual interest charged on the outstanding debt before each month's payment.
     */
    default BigDecimal annualDebtInterest() {
        return BigDecimal.ZERO;
    }

    /**
     * Factor applied to the month's income, e.g. zero for a month without pay.
     */
    default BigDecimal incomeMultiplier(int month) {
        return BigDecimal.ONE;
    }

    /**
     * Factor applied to the month's inflated expenses.
     */
    default BigDecimal expenseMultiplier(int month) {
        return BigDecimal.ONE;
    }

    /**
     * Called once before month 1.
     */
    default void start(SimulationState state, BigDecimal monthlyExpenses) {
    }

    /**
     * Called each month before the surplus is computed.
     */
    default void applyLifeEvents(SimulationState state, MonthContext context) {
    }

    /**
     * @param surplus income minus expenses for the month; may be negative
     * @return payment requested this month; the state caps it at the outstanding balance
     */
    BigDecimal debtPayment(SimulationState state, BigDecimal surplus, MonthContext context);

    /**
     * Distributes what is left of the surplus after the debt payment. Negative amounts are drawn from cash.
     */
    void allocate(SimulationState state, BigDecimal remaining, MonthContext context);

    /**
     * Applies the month's interest and investment returns.
     */
    void applyReturns(SimulationState state, MonthContext context);
}
