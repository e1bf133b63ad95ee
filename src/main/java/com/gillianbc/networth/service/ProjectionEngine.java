package com.gillianbc.networth.service;

import com.gillianbc.networth.model.FinancialProfile;
import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.model.PromotionEvent;
import com.gillianbc.networth.model.TimelinePoint;
import com.gillianbc.networth.service.policy.VariantPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Steps a profile month by month into a timeline under one of the model variants.
 * <p>
 * Each month:
 * <ol>
 *     <li>apply any income event scheduled for the month (permanent raise, one-off bonus to cash)</li>
 *     <li>inflate the base expenses by {@code (1 + inflation/12)^(month-1)} and apply the variant's
 *     seasonal income and expense multipliers</li>
 *     <li>let the variant apply life events, then compute the surplus {@code income - expenses}</li>
 *     <li>accrue debt interest, pay debt, allocate the rest and apply returns per the variant</li>
 *     <li>emit a {@link TimelinePoint}</li>
 * </ol>
 * All randomness comes from the seed passed in: the promotion schedule, market jitter and life
 * events each get their own generator derived from it, so two runs with the same seed, horizon and
 * variant see identical events regardless of the profile. Runs share no mutable state.
 */
@Slf4j
@Service
public class ProjectionEngine {

    private static final long MARKET_STREAM = 0x5DEECE66DL;
    private static final long LIFE_EVENT_STREAM = 0x9E3779B97F4A7C15L;

    private final Map<ModelVariant, VariantPolicy> policies = new EnumMap<>(ModelVariant.class);
    private final PromotionScheduler promotionScheduler;

    public ProjectionEngine(List<VariantPolicy> policies, PromotionScheduler promotionScheduler) {
        Objects.requireNonNull(policies, "policies must not be null");
        for (VariantPolicy policy : policies) {
            this.policies.put(policy.variant(), policy);
        }
        for (ModelVariant variant : ModelVariant.values()) {
            if (!this.policies.containsKey(variant)) {
                throw new IllegalStateException("No policy registered for model variant " + variant.wireName());
            }
        }
        this.promotionScheduler = Objects.requireNonNull(promotionScheduler, "promotionScheduler must not be null");
    }

    /**
     * Projects with a promotion schedule generated from the seed.
     *
     * @param profile valid profile (see {@link ProfileValidator})
     * @param months  horizon, >= 1; long horizons (360 months and more) are supported
     * @param variant economic model
     * @param seed    seed for every random draw of the run
     * @return exactly {@code months} points, months 1..months in order
     */
    public List<TimelinePoint> project(FinancialProfile profile, int months, ModelVariant variant, long seed) {
        ProfileValidator.validateMonths(months);
        Objects.requireNonNull(variant, "variant must not be null");
        return project(profile, months, variant, seed, promotionScheduler.schedule(months, variant, seed));
    }

    /**
     * Projects with an explicit promotion schedule, typically one shared between a status-quo
     * and a what-if run.
     */
    public List<TimelinePoint> project(FinancialProfile profile,
                                       int months,
                                       ModelVariant variant,
                                       long seed,
                                       List<PromotionEvent> schedule) {
        ProfileValidator.validateProfile(profile);
        ProfileValidator.validateMonths(months);
        Objects.requireNonNull(variant, "variant must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");

        log.info("Projecting {} months under the {} model", months, variant.wireName());

        VariantPolicy policy = policies.get(variant);
        Map<Integer, List<PromotionEvent>> eventsByMonth = groupByMonth(schedule);
        Random marketRandom = new Random(seed ^ MARKET_STREAM);
        Random eventRandom = new Random(seed ^ LIFE_EVENT_STREAM);

        BigDecimal baseExpenses = profile.totalMonthlyExpenses();
        BigDecimal inflationStep = BigDecimal.ONE.add(Amounts.monthly(policy.annualInflation()), Amounts.MATH_CONTEXT);

        log.debug("Inputs: income {}, expenses {}, savings {}, debt {}, {} income events",
                profile.getMonthlyIncome(), baseExpenses, profile.getCurrentSavings(), profile.getCurrentDebt(), schedule.size());

        SimulationState state = new SimulationState(profile);
        policy.start(state, baseExpenses);

        List<TimelinePoint> timeline = new ArrayList<>(months);
        BigDecimal inflationFactor = BigDecimal.ONE;
        for (int month = 1; month <= months; month++) {
            // Income events take effect from the start of their month
            for (PromotionEvent event : eventsByMonth.getOrDefault(month, List.of())) {
                state.raiseIncome(event.getSalaryIncreaseFraction());
                if (event.getBonusFraction().signum() > 0) {
                    BigDecimal annualIncome = state.getMonthlyIncome().multiply(Amounts.MONTHS_PER_YEAR, Amounts.MATH_CONTEXT);
                    state.receiveWindfall(annualIncome.multiply(event.getBonusFraction(), Amounts.MATH_CONTEXT));
                }
            }

            BigDecimal adjustedExpenses = baseExpenses
                    .multiply(inflationFactor, Amounts.MATH_CONTEXT)
                    .multiply(policy.expenseMultiplier(month), Amounts.MATH_CONTEXT);
            MonthContext context = new MonthContext(month, months, adjustedExpenses, marketRandom, eventRandom);

            policy.applyLifeEvents(state, context);

            BigDecimal adjustedIncome = state.getMonthlyIncome().multiply(policy.incomeMultiplier(month), Amounts.MATH_CONTEXT);
            BigDecimal surplus = adjustedIncome.subtract(adjustedExpenses, Amounts.MATH_CONTEXT);
            state.recordSpending(adjustedExpenses);
            state.recordSaving(surplus);

            state.accrueDebtInterest(Amounts.monthly(policy.annualDebtInterest()));
            BigDecimal paid = state.payDebt(policy.debtPayment(state, surplus, context));
            policy.allocate(state, surplus.subtract(paid, Amounts.MATH_CONTEXT), context);
            policy.applyReturns(state, context);

            timeline.add(state.snapshot(month));
            inflationFactor = inflationFactor.multiply(inflationStep, Amounts.MATH_CONTEXT);
        }

        TimelinePoint last = timeline.get(timeline.size() - 1);
        log.debug("Result after {} months: net worth {}, savings {}, debt {}, investments {}, emergency fund {}",
                months, last.getNetWorth(), last.getSavings(), last.getDebt(),
                state.getInvestmentPortfolio(), state.getEmergencyFund());
        return Collections.unmodifiableList(timeline);
    }

    /**
     * The canonical default projection: the realistic model. Used whenever no model is chosen,
     * so status-quo and what-if runs always share a baseline.
     */
    public List<TimelinePoint> projectStatusQuo(FinancialProfile profile, int months, long seed) {
        return project(profile, months, ModelVariant.REALISTIC, seed);
    }

    private static Map<Integer, List<PromotionEvent>> groupByMonth(List<PromotionEvent> schedule) {
        Map<Integer, List<PromotionEvent>> byMonth = new HashMap<>();
        for (PromotionEvent event : schedule) {
            byMonth.computeIfAbsent(event.getMonth(), m -> new ArrayList<>()).add(event);
        }
        return byMonth;
    }
}
