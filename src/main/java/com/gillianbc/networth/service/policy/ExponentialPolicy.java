package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.Amounts;
import com.gillianbc.networth.service.MonthContext;
import com.gillianbc.networth.service.SimulationState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Compound growth: most of the surplus is invested at a high fixed return, half of the
 * surplus goes to debt. Both the investment share and the return step down after
 * 20 and 30 years.
 */
@Component
public class ExponentialPolicy extends AbstractVariantPolicy {

    static final int TWENTY_YEARS = 240;
    static final int THIRTY_YEARS = 360;

    private static final BigDecimal SHARE_FIRST_20_YEARS = new BigDecimal("0.80");
    private static final BigDecimal SHARE_TO_30_YEARS = new BigDecimal("0.70");
    private static final BigDecimal SHARE_AFTER_30_YEARS = new BigDecimal("0.60");
    private static final BigDecimal RETURN_FIRST_20_YEARS = new BigDecimal("0.12");
    private static final BigDecimal RETURN_TO_30_YEARS = new BigDecimal("0.10");
    private static final BigDecimal RETURN_AFTER_30_YEARS = new BigDecimal("0.08");

    public ExponentialPolicy() {
        super(new BigDecimal("0.025"), new BigDecimal("0.50"));
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.EXPONENTIAL;
    }

    @Override
    public void allocate(SimulationState state, BigDecimal remaining, MonthContext context) {
        invest(state, remaining, investmentShare(context.getMonth()));
    }

    @Override
    public void applyReturns(SimulationState state, MonthContext context) {
        state.growInvestments(Amounts.monthly(annualReturn(context.getMonth())));
    }

    static BigDecimal investmentShare(int month) {
        if (month <= TWENTY_YEARS) {
            return SHARE_FIRST_20_YEARS;
        }
        return month <= THIRTY_YEARS ? SHARE_TO_30_YEARS : SHARE_AFTER_30_YEARS;
    }

    static BigDecimal annualReturn(int month) {
        if (month <= TWENTY_YEARS) {
            return RETURN_FIRST_20_YEARS;
        }
        return month <= THIRTY_YEARS ? RETURN_TO_30_YEARS : RETURN_AFTER_30_YEARS;
    }
}
