package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.Amounts;
import com.gillianbc.networth.service.MonthContext;
import com.gillianbc.networth.service.SimulationState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Emergency fund first.
 * <p>
 * Until the fund holds six months of expenses, up to 80% of each month's surplus is earmarked
 * for it and no debt payments are made. Once the target is met, 40% of the surplus goes
 * to debt. Cash outside the emergency fund earns 2.5% a year; the fund itself earns nothing.
 */
@Component
public class ConservativePolicy extends AbstractVariantPolicy {

    static final BigDecimal EMERGENCY_FUND_MONTHS = BigDecimal.valueOf(6);
    private static final BigDecimal EMERGENCY_SHARE = new BigDecimal("0.80");
    private static final BigDecimal CASH_RATE = new BigDecimal("0.025");

    public ConservativePolicy() {
        super(new BigDecimal("0.03"), new BigDecimal("0.40"));
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.CONSERVATIVE;
    }

    @Override
    public void start(SimulationState state, BigDecimal monthlyExpenses) {
        state.openEmergencyFund(monthlyExpenses.multiply(EMERGENCY_FUND_MONTHS, Amounts.MATH_CONTEXT));
    }

    @Override
    public BigDecimal debtPayment(SimulationState state, BigDecimal surplus, MonthContext context) {
        if (!state.isEmergencyFundComplete()) {
            return BigDecimal.ZERO;
        }
        return super.debtPayment(state, surplus, context);
    }

    @Override
    public void allocate(SimulationState state, BigDecimal remaining, MonthContext context) {
        state.addCash(remaining);
        if (remaining.signum() > 0 && !state.isEmergencyFundComplete()) {
            state.earmarkEmergencyFund(remaining.multiply(EMERGENCY_SHARE, Amounts.MATH_CONTEXT).min(state.emergencyFundGap()));
        }
    }

    @Override
    public void applyReturns(SimulationState state, MonthContext context) {
        BigDecimal earning = state.getCashSavings().subtract(state.getEmergencyFund(), Amounts.MATH_CONTEXT);
        earnInterestOnCash(state, earning, Amounts.monthly(CASH_RATE));
    }
}
