package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.Amounts;
import com.gillianbc.networth.service.MonthContext;
import com.gillianbc.networth.service.SimulationState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Everything held as cash at 2% a year; debt charges 5% a year and takes 30% of the surplus.
 */
@Component
public class SavingsPolicy extends AbstractVariantPolicy {

    private static final BigDecimal CASH_RATE = new BigDecimal("0.02");
    private static final BigDecimal DEBT_RATE = new BigDecimal("0.05");

    public SavingsPolicy() {
        super(new BigDecimal("0.025"), new BigDecimal("0.30"));
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.SAVINGS;
    }

    @Override
    public BigDecimal annualDebtInterest() {
        return DEBT_RATE;
    }

    @Override
    public void applyReturns(SimulationState state, MonthContext context) {
        earnInterestOnCash(state, state.getCashSavings(), Amounts.monthly(CASH_RATE));
    }
}
