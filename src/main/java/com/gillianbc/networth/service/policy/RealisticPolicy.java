package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.market.MarketDataProvider;
import com.gillianbc.networth.model.MarketSample;
import com.gillianbc.networth.model.MarketTrend;
import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.Amounts;
import com.gillianbc.networth.service.MonthContext;
import com.gillianbc.networth.service.SimulationState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Market-correlated projection and the default model.
 * <p>
 * The surplus first fills an emergency fund of six months of expenses; what is left is split
 * evenly between investments and cash. Investments earn the combined S&amp;P 500 / NASDAQ sample
 * for the month, scaled down after 20 and 30 years, plus a sector adjustment for the current
 * market trend (+2% a year in a bull market, -1% in a bear market). Cash earns 2% a year.
 * <p>
 * Debt accrues 5% a year before each payment of 30% of the surplus. Past 20 years rare life
 * events (windfall, major expense, career change) may occur, and past 30 years income tapers
 * off towards retirement.
 */
@Slf4j
@Component
public class RealisticPolicy extends AbstractVariantPolicy {

    static final int TWENTY_YEARS = 240;
    static final int THIRTY_YEARS = 360;

    static final BigDecimal EMERGENCY_FUND_MONTHS = BigDecimal.valueOf(6);
    private static final BigDecimal INVESTMENT_SHARE = new BigDecimal("0.50");
    private static final BigDecimal CASH_RATE = new BigDecimal("0.02");
    private static final BigDecimal DEBT_RATE = new BigDecimal("0.05");
    private static final BigDecimal BULL_ADJUSTMENT = new BigDecimal("0.02");
    private static final BigDecimal BEAR_ADJUSTMENT = new BigDecimal("-0.01");
    private static final BigDecimal SCALE_TO_30_YEARS = new BigDecimal("0.8");
    private static final BigDecimal SCALE_AFTER_30_YEARS = new BigDecimal("0.6");

    static final double LIFE_EVENT_PROBABILITY = 0.001;
    private static final BigDecimal WINDFALL_MONTHS_OF_INCOME = BigDecimal.valueOf(6);
    private static final BigDecimal MAJOR_EXPENSE_MONTHS = BigDecimal.valueOf(3);
    private static final BigDecimal CAREER_CHANGE_RAISE = new BigDecimal("0.10");

    // Income falls 2% of its pre-retirement level per year past 30 years, never below 40%
    private static final BigDecimal TAPER_PER_YEAR = new BigDecimal("0.02");
    private static final BigDecimal TAPER_FLOOR = new BigDecimal("0.40");

    private final MarketDataProvider marketDataProvider;
    // Read once from the historical closes and applied to every month, extrapolated bust months included
    private final BigDecimal trendAdjustment;

    public RealisticPolicy(MarketDataProvider marketDataProvider) {
        super(new BigDecimal("0.03"), new BigDecimal("0.30"));
        this.marketDataProvider = Objects.requireNonNull(marketDataProvider, "marketDataProvider must not be null");
        this.trendAdjustment = monthlyTrendAdjustment(marketDataProvider.currentTrend());
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.REALISTIC;
    }

    @Override
    public BigDecimal annualDebtInterest() {
        return DEBT_RATE;
    }

    @Override
    public BigDecimal incomeMultiplier(int month) {
        return retirementTaper(month);
    }

    @Override
    public void start(SimulationState state, BigDecimal monthlyExpenses) {
        state.openEmergencyFund(monthlyExpenses.multiply(EMERGENCY_FUND_MONTHS, Amounts.MATH_CONTEXT));
    }

    /**
     * Two draws every month past 20 years whether or not an event fires, so the event stream
     * lines up between runs that share a seed.
     */
    @Override
    public void applyLifeEvents(SimulationState state, MonthContext context) {
        if (context.getMonth() <= TWENTY_YEARS) {
            return;
        }
        double roll = context.getEventRandom().nextDouble();
        double kind = context.getEventRandom().nextDouble();
        if (roll >= LIFE_EVENT_PROBABILITY) {
            return;
        }

        if (kind < 1.0 / 3) {
            BigDecimal windfall = state.getMonthlyIncome().multiply(WINDFALL_MONTHS_OF_INCOME, Amounts.MATH_CONTEXT);
            log.debug("Month {}: windfall of {}", context.getMonth(), windfall);
            state.receiveWindfall(windfall);
        } else if (kind < 2.0 / 3) {
            BigDecimal expense = context.getAdjustedExpenses().multiply(MAJOR_EXPENSE_MONTHS, Amounts.MATH_CONTEXT);
            log.debug("Month {}: major expense of {}", context.getMonth(), expense);
            state.payUnplannedExpense(expense);
        } else {
            log.debug("Month {}: career change", context.getMonth());
            state.raiseIncome(CAREER_CHANGE_RAISE);
        }
    }

    @Override
    public void allocate(SimulationState state, BigDecimal remaining, MonthContext context) {
        BigDecimal toInvest = remaining;
        if (remaining.signum() > 0 && !state.isEmergencyFundComplete()) {
            BigDecimal contribution = remaining.min(state.emergencyFundGap());
            state.addCash(contribution);
            state.earmarkEmergencyFund(contribution);
            toInvest = remaining.subtract(contribution, Amounts.MATH_CONTEXT);
        }
        invest(state, toInvest, INVESTMENT_SHARE);
    }

    /**
     * Draws the market sample every month, even with nothing invested yet, so the market
     * stream stays aligned between runs that share a seed.
     */
    @Override
    public void applyReturns(SimulationState state, MonthContext context) {
        MarketSample sample = marketDataProvider.combinedSampleFor(context.getMonth(), context.getMarketRandom());
        BigDecimal marketReturn = BigDecimal.valueOf(sample.getMonthlyReturn())
                .multiply(horizonScale(context.getMonth()), Amounts.MATH_CONTEXT)
                .add(trendAdjustment, Amounts.MATH_CONTEXT);
        state.growInvestments(marketReturn);
        earnInterestOnCash(state, state.getCashSavings(), Amounts.monthly(CASH_RATE));
    }

    BigDecimal trendAdjustment() {
        return trendAdjustment;
    }

    static BigDecimal horizonScale(int month) {
        if (month <= TWENTY_YEARS) {
            return BigDecimal.ONE;
        }
        return month <= THIRTY_YEARS ? SCALE_TO_30_YEARS : SCALE_AFTER_30_YEARS;
    }

    static BigDecimal retirementTaper(int month) {
        if (month <= THIRTY_YEARS) {
            return BigDecimal.ONE;
        }
        BigDecimal yearsRetired = BigDecimal.valueOf(month - THIRTY_YEARS).divide(Amounts.MONTHS_PER_YEAR, Amounts.MATH_CONTEXT);
        return BigDecimal.ONE.subtract(TAPER_PER_YEAR.multiply(yearsRetired, Amounts.MATH_CONTEXT)).max(TAPER_FLOOR);
    }

    private static BigDecimal monthlyTrendAdjustment(MarketTrend trend) {
        return switch (trend.getDirection()) {
            case BULL -> Amounts.monthly(BULL_ADJUSTMENT);
            case BEAR -> Amounts.monthly(BEAR_ADJUSTMENT);
            case SIDEWAYS -> BigDecimal.ZERO;
        };
    }
}
