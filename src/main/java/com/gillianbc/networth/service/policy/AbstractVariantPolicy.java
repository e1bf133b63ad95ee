package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.service.Amounts;
import com.gillianbc.networth.service.MonthContext;
import com.gillianbc.networth.service.SimulationState;

import java.math.BigDecimal;

/**
 * Debt paid as a fixed share of a positive surplus, everything else kept as cash.
 */
abstract class AbstractVariantPolicy implements VariantPolicy {

    private final BigDecimal annualInflation;
    private final BigDecimal debtPaymentFraction;

    AbstractVariantPolicy(BigDecimal annualInflation, BigDecimal debtPaymentFraction) {
        this.annualInflation = annualInflation;
        this.debtPaymentFraction = debtPaymentFraction;
    }

    @Override
    public BigDecimal annualInflation() {
        return annualInflation;
    }

    BigDecimal debtPaymentFraction() {
        return debtPaymentFraction;
    }

    @Override
    public BigDecimal debtPayment(SimulationState state, BigDecimal surplus, MonthContext context) {
        return Amounts.positivePart(surplus).multiply(debtPaymentFraction, Amounts.MATH_CONTEXT);
    }

    @Override
    public void allocate(SimulationState state, BigDecimal remaining, MonthContext context) {
        state.addCash(remaining);
    }

    /**
     * Splits a positive amount between investments and cash; a shortfall comes out of cash.
     */
    static void invest(SimulationState state, BigDecimal remaining, BigDecimal investmentShare) {
        if (remaining.signum() > 0) {
            BigDecimal invested = remaining.multiply(investmentShare, Amounts.MATH_CONTEXT);
            state.addInvestment(invested);
            state.addCash(remaining.subtract(invested, Amounts.MATH_CONTEXT));
        } else {
            state.addCash(remaining);
        }
    }

    /**
     * Interest on a positive cash balance; overdrawn cash earns nothing.
     */
    static void earnInterestOnCash(SimulationState state, BigDecimal earningBalance, BigDecimal monthlyRate) {
        if (earningBalance.signum() > 0) {
            state.addCash(earningBalance.multiply(monthlyRate, Amounts.MATH_CONTEXT));
        }
    }
}
