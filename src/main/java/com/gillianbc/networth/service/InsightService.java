package com.gillianbc.networth.service;

import com.gillianbc.networth.model.Insight;
import com.gillianbc.networth.model.InsightType;
import com.gillianbc.networth.model.LongTermSummary;
import com.gillianbc.networth.model.Milestone;
import com.gillianbc.networth.model.TimelinePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives comparison insights between two timelines and headline figures for long projections.
 */
@Slf4j
@Service
public class InsightService {

    public static final int LONG_TERM_MONTHS = 240;

    static final BigDecimal EXTRA_SAVINGS_THRESHOLD = new BigDecimal("5000");
    static final BigDecimal FASTER_GROWTH_FACTOR = new BigDecimal("1.5");
    static final BigDecimal MILLION = new BigDecimal("1000000");
    static final BigDecimal TEN_MILLION = new BigDecimal("10000000");
    static final BigDecimal TEN = BigDecimal.TEN;
    static final BigDecimal CONSERVATIVE_SAVINGS_SHARE = new BigDecimal("0.8");

    /**
     * Compares the final points of the two timelines.
     * <ul>
     *     <li>net worth increase or decrease, with the difference</li>
     *     <li>extra savings when the what-if savings exceed the status quo by more than 5,000</li>
     *     <li>debt free when only the what-if ends with no debt</li>
     *     <li>faster growth when the what-if average monthly net worth growth is more than
     *     1.5 times the status-quo growth, or positive against a flat or shrinking status quo</li>
     * </ul>
     * Empty timelines produce no insights. Timelines of different lengths are compared as given.
     */
    public List<Insight> compare(List<TimelinePoint> statusQuo, List<TimelinePoint> whatIf) {
        Objects.requireNonNull(statusQuo, "statusQuo must not be null");
        Objects.requireNonNull(whatIf, "whatIf must not be null");
        List<Insight> insights = new ArrayList<>();
        if (statusQuo.isEmpty() || whatIf.isEmpty()) {
            return insights;
        }

        TimelinePoint sqFinal = statusQuo.get(statusQuo.size() - 1);
        TimelinePoint wiFinal = whatIf.get(whatIf.size() - 1);
        BigDecimal netWorthDiff = wiFinal.getNetWorth().subtract(sqFinal.getNetWorth());
        BigDecimal savingsDiff = wiFinal.getSavings().subtract(sqFinal.getSavings());

        if (netWorthDiff.signum() > 0) {
            insights.add(new Insight(InsightType.NET_WORTH_INCREASE, netWorthDiff,
                    "Your net worth could increase by " + formatCurrency(netWorthDiff) + " in " + statusQuo.size() + " months"));
        } else if (netWorthDiff.signum() < 0) {
            insights.add(new Insight(InsightType.NET_WORTH_DECREASE, netWorthDiff,
                    "This path could decrease your net worth by " + formatCurrency(netWorthDiff.abs())));
        }

        if (savingsDiff.compareTo(EXTRA_SAVINGS_THRESHOLD) > 0) {
            insights.add(new Insight(InsightType.EXTRA_SAVINGS, savingsDiff,
                    "You could save an extra " + formatCurrency(savingsDiff) + " by making these changes"));
        }

        if (wiFinal.getDebt().signum() == 0 && sqFinal.getDebt().signum() > 0) {
            insights.add(new Insight(InsightType.DEBT_FREE, null, "You could be debt-free with these adjustments"));
        }

        BigDecimal sqGrowth = averageMonthlyGrowth(statusQuo);
        BigDecimal wiGrowth = averageMonthlyGrowth(whatIf);
        if (growsFaster(sqGrowth, wiGrowth)) {
            insights.add(new Insight(InsightType.FASTER_GROWTH, null, "Your financial growth rate could increase by over 50%"));
        }

        log.debug("Generated {} insights", insights.size());
        return insights;
    }

    /**
     * @return headline figures, or empty when the timeline is shorter than 20 years
     */
    public Optional<LongTermSummary> summarizeLongTerm(List<TimelinePoint> timeline) {
        Objects.requireNonNull(timeline, "timeline must not be null");
        if (timeline.size() < LONG_TERM_MONTHS) {
            return Optional.empty();
        }

        TimelinePoint first = timeline.get(0);
        TimelinePoint last = timeline.get(timeline.size() - 1);
        BigDecimal initial = first.getNetWorth();
        BigDecimal finalNetWorth = last.getNetWorth();
        BigDecimal years = BigDecimal.valueOf(timeline.size()).divide(Amounts.MONTHS_PER_YEAR, 1, RoundingMode.HALF_UP);

        BigDecimal totalGrowthPercent = null;
        BigDecimal annualGrowthPercent = null;
        if (initial.signum() > 0) {
            BigDecimal ratio = finalNetWorth.divide(initial, Amounts.MATH_CONTEXT);
            totalGrowthPercent = ratio.subtract(BigDecimal.ONE).multiply(Amounts.HUNDRED).setScale(2, RoundingMode.HALF_UP);
            if (ratio.signum() > 0) {
                double cagr = Math.pow(ratio.doubleValue(), 1.0 / years.doubleValue()) - 1;
                if (Double.isFinite(cagr)) {
                    annualGrowthPercent = BigDecimal.valueOf(cagr).multiply(Amounts.HUNDRED).setScale(2, RoundingMode.HALF_UP);
                }
            }
        }

        Set<Milestone> milestones = EnumSet.noneOf(Milestone.class);
        if (initial.signum() > 0 && finalNetWorth.compareTo(initial.multiply(TEN)) > 0) {
            milestones.add(Milestone.TEN_X_WEALTH);
        }
        if (finalNetWorth.compareTo(MILLION) > 0) {
            milestones.add(Milestone.MILLIONAIRE);
        }
        if (finalNetWorth.compareTo(TEN_MILLION) > 0) {
            milestones.add(Milestone.MULTI_MILLIONAIRE);
        }
        if (last.getDebt().signum() == 0 && timeline.stream().anyMatch(p -> p.getDebt().signum() > 0)) {
            milestones.add(Milestone.DEBT_FREE);
        }
        if (last.getSavings().compareTo(finalNetWorth.multiply(CONSERVATIVE_SAVINGS_SHARE)) > 0) {
            milestones.add(Milestone.CONSERVATIVE_SAVINGS);
        }

        return Optional.of(new LongTermSummary(years, initial, finalNetWorth, totalGrowthPercent, annualGrowthPercent, milestones));
    }

    /**
     * Formats an amount as US dollars with two decimals, e.g. {@code $1,234.50}.
     */
    public static String formatCurrency(BigDecimal amount) {
        NumberFormat format = NumberFormat.getCurrencyInstance(Locale.US);
        format.setMinimumFractionDigits(2);
        format.setMaximumFractionDigits(2);
        return format.format(amount);
    }

    // Scaling a zero or negative baseline by 1.5 does not raise the bar, so any real growth counts
    private static boolean growsFaster(BigDecimal statusQuoGrowth, BigDecimal whatIfGrowth) {
        if (statusQuoGrowth.signum() <= 0) {
            return whatIfGrowth.signum() > 0;
        }
        return whatIfGrowth.compareTo(statusQuoGrowth.multiply(FASTER_GROWTH_FACTOR)) > 0;
    }

    private static BigDecimal averageMonthlyGrowth(List<TimelinePoint> timeline) {
        BigDecimal change = timeline.get(timeline.size() - 1).getNetWorth().subtract(timeline.get(0).getNetWorth());
        return change.divide(BigDecimal.valueOf(timeline.size()), Amounts.MATH_CONTEXT);
    }
}
