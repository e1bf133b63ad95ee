package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.MonthContext;
import com.gillianbc.networth.service.SimulationState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Steady growth: no inflation, no returns, the monthly surplus is banked as cash
 * and 30% of it goes towards debt.
 */
@Component
public class LinearPolicy extends AbstractVariantPolicy {

    public LinearPolicy() {
        super(BigDecimal.ZERO, new BigDecimal("0.30"));
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.LINEAR;
    }

    @Override
    public void applyReturns(SimulationState state, MonthContext context) {
        // cash does not earn anything in the linear model
    }
}
