package com.gillianbc.networth.service;

import com.gillianbc.networth.market.MarketDataProvider;
import com.gillianbc.networth.model.FinancialProfile;
import com.gillianbc.networth.model.MonthlyExpenses;
import com.gillianbc.networth.model.TimelinePoint;
import com.gillianbc.networth.service.policy.ConservativePolicy;
import com.gillianbc.networth.service.policy.ExponentialPolicy;
import com.gillianbc.networth.service.policy.LinearPolicy;
import com.gillianbc.networth.service.policy.OptimisticPolicy;
import com.gillianbc.networth.service.policy.RealisticPolicy;
import com.gillianbc.networth.service.policy.SavingsPolicy;
import com.gillianbc.networth.service.policy.SeasonalPolicy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;

/**
 * Shared test data: a household earning 5,000 a month and spending 3,000, with 10,000 saved and 5,000 owed.
 */
@Slf4j
public final class Fixtures {

    public static final String INCOME = "5000.00";
    public static final String SAVINGS = "10000.00";
    public static final String DEBT = "5000.00";

    private Fixtures() {
    }

    public static MonthlyExpenses expenses() {
        return new MonthlyExpenses(
                new BigDecimal("1500.00"),
                new BigDecimal("600.00"),
                new BigDecimal("300.00"),
                new BigDecimal("200.00"),
                new BigDecimal("150.00"),
                new BigDecimal("250.00"));
    }

    public static FinancialProfile profile() {
        return new FinancialProfile(new BigDecimal(INCOME), expenses(), new BigDecimal(SAVINGS), new BigDecimal(DEBT));
    }

    public static FinancialProfile profile(String savings, String debt) {
        return new FinancialProfile(new BigDecimal(INCOME), expenses(), new BigDecimal(savings), new BigDecimal(debt));
    }

    public static ProjectionEngine engine() {
        return new ProjectionEngine(
                List.of(new LinearPolicy(),
                        new ExponentialPolicy(),
                        new SeasonalPolicy(),
                        new RealisticPolicy(new MarketDataProvider()),
                        new ConservativePolicy(),
                        new SavingsPolicy(),
                        new OptimisticPolicy()),
                new PromotionScheduler());
    }

    public static TimelinePoint point(int month, String savings, String debt) {
        return new TimelinePoint(month, new BigDecimal(savings), new BigDecimal(debt), BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public static void logTimeline(String description, List<TimelinePoint> timeline) {
        log.info("\n==== {} ====", description);
        log.info("month, savings, debt, netWorth, totalSpent, totalSaved");
        for (TimelinePoint p : timeline) {
            log.info("{},{},{},{},{},{}",
                    p.getMonth(), p.getSavings(), p.getDebt(), p.getNetWorth(), p.getTotalSpent(), p.getTotalSaved());
        }
    }
}
