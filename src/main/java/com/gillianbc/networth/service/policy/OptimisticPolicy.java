package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.Amounts;
import com.gillianbc.networth.service.MonthContext;
import com.gillianbc.networth.service.SimulationState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Best case: 80% of the surplus invested at 15% a year, 60% of the surplus to debt.
 */
@Component
public class OptimisticPolicy extends AbstractVariantPolicy {

    private static final BigDecimal INVESTMENT_SHARE = new BigDecimal("0.80");
    private static final BigDecimal ANNUAL_RETURN = new BigDecimal("0.15");

    public OptimisticPolicy() {
        super(new BigDecimal("0.02"), new BigDecimal("0.60"));
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.OPTIMISTIC;
    }

    @Override
    public void allocate(SimulationState state, BigDecimal remaining, MonthContext context) {
        invest(state, remaining, INVESTMENT_SHARE);
    }

    @Override
    public void applyReturns(SimulationState state, MonthContext context) {
        state.growInvestments(Amounts.monthly(ANNUAL_RETURN));
    }
}
