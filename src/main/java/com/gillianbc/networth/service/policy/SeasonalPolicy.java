package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.Amounts;
import com.gillianbc.networth.service.MonthContext;
import com.gillianbc.networth.service.SimulationState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Seasonal income and spending. Month 1 is taken as January.
 * <p>
 * Income stops over the summer (June to August, a school-year salary), spending follows a
 * 12-month table (holidays, tax season, back to school) and cash earns a modest rate scaled
 * by the same seasonal factor. A quarter of any surplus goes to debt.
 */
@Component
public class SeasonalPolicy extends AbstractVariantPolicy {

    private static final Set<Integer> NO_INCOME_MONTHS = Set.of(6, 7, 8);
    private static final BigDecimal[] EXPENSE_FACTORS = {
            new BigDecimal("1.10"), // January: holiday bills
            new BigDecimal("0.90"),
            new BigDecimal("1.00"),
            new BigDecimal("1.05"), // April: tax season
            new BigDecimal("0.95"),
            new BigDecimal("1.00"),
            new BigDecimal("1.10"), // July: summer activities
            new BigDecimal("1.00"),
            new BigDecimal("0.95"), // September: back to school
            new BigDecimal("1.00"),
            new BigDecimal("1.10"),
            new BigDecimal("1.20")  // December: holiday season
    };
    private static final BigDecimal CASH_RATE = new BigDecimal("0.02");

    public SeasonalPolicy() {
        super(new BigDecimal("0.025"), new BigDecimal("0.25"));
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.SEASONAL;
    }

    @Override
    public BigDecimal incomeMultiplier(int month) {
        return NO_INCOME_MONTHS.contains(MonthContext.calendarMonth(month)) ? BigDecimal.ZERO : BigDecimal.ONE;
    }

    @Override
    public BigDecimal expenseMultiplier(int month) {
        return EXPENSE_FACTORS[MonthContext.calendarMonth(month) - 1];
    }

    @Override
    public void applyReturns(SimulationState state, MonthContext context) {
        BigDecimal rate = Amounts.monthly(CASH_RATE).multiply(expenseMultiplier(context.getMonth()), Amounts.MATH_CONTEXT);
        earnInterestOnCash(state, state.getCashSavings(), rate);
    }
}
