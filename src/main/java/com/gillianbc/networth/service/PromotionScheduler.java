package com.gillianbc.networth.service;

import com.gillianbc.networth.model.InvalidProjectionInputException;
import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.model.PromotionEvent;
import com.gillianbc.networth.model.PromotionKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Lays out the income-growth events of a projection before stepping starts.
 * <p>
 * Events are roughly two years apart: each gap is 24 months plus a uniform jitter of up to six
 * months either way. Every variant has its own raise, bonus and job-change terms; the linear
 * model has none. Each event consumes exactly two random numbers (gap, then kind), so the
 * schedule depends only on the seed, the horizon and the variant.
 */
@Slf4j
@Service
public class PromotionScheduler {

    static final int BASE_INTERVAL_MONTHS = 24;
    static final int MAX_JITTER_MONTHS = 6;

    private static final Map<ModelVariant, PromotionTerms> TERMS = new EnumMap<>(ModelVariant.class);

    static {
        TERMS.put(ModelVariant.LINEAR, PromotionTerms.NONE);
        TERMS.put(ModelVariant.EXPONENTIAL, new PromotionTerms("0.05", "0.10", 0.30, 0.0, "0"));
        TERMS.put(ModelVariant.SEASONAL, new PromotionTerms("0.03", "0.05", 0.20, 0.0, "0"));
        TERMS.put(ModelVariant.REALISTIC, new PromotionTerms("0.04", "0.08", 0.30, 0.10, "0.12"));
        TERMS.put(ModelVariant.CONSERVATIVE, new PromotionTerms("0.02", "0.03", 0.20, 0.0, "0"));
        TERMS.put(ModelVariant.SAVINGS, new PromotionTerms("0.01", "0", 0.0, 0.0, "0"));
        TERMS.put(ModelVariant.OPTIMISTIC, new PromotionTerms("0.08", "0.15", 0.40, 0.20, "0.20"));
    }

    /**
     * @param months  projection horizon, >= 1
     * @param variant model whose terms apply
     * @param random  source for gaps and event kinds; owned by the caller's run
     * @return events in month order, all within {@code 1..months}
     */
    public List<PromotionEvent> schedule(int months, ModelVariant variant, Random random) {
        Objects.requireNonNull(variant, "variant must not be null");
        Objects.requireNonNull(random, "random must not be null");
        if (months < 1) {
            throw new InvalidProjectionInputException("months must be >= 1");
        }

        PromotionTerms terms = TERMS.get(variant);
        if (!terms.hasEvents()) {
            return List.of();
        }

        List<PromotionEvent> events = new ArrayList<>();
        int month = 0;
        while (true) {
            int jitter = random.nextInt(2 * MAX_JITTER_MONTHS + 1) - MAX_JITTER_MONTHS;
            double kindRoll = random.nextDouble();
            month += BASE_INTERVAL_MONTHS + jitter;
            if (month > months) {
                break;
            }
            events.add(terms.eventFor(month, kindRoll));
        }

        log.debug("Scheduled {} income events for {} over {} months", events.size(), variant.wireName(), months);
        return Collections.unmodifiableList(events);
    }

    public List<PromotionEvent> schedule(int months, ModelVariant variant, long seed) {
        return schedule(months, variant, new Random(seed));
    }

    private static final class PromotionTerms {

        static final PromotionTerms NONE = new PromotionTerms("0", "0", 0.0, 0.0, "0");

        private final BigDecimal raise;
        private final BigDecimal bonus;
        private final double bonusProbability;
        private final double jobChangeProbability;
        private final BigDecimal jobChangeRaise;

        PromotionTerms(String raise, String bonus, double bonusProbability, double jobChangeProbability, String jobChangeRaise) {
            this.raise = new BigDecimal(raise);
            this.bonus = new BigDecimal(bonus);
            this.bonusProbability = bonusProbability;
            this.jobChangeProbability = jobChangeProbability;
            this.jobChangeRaise = new BigDecimal(jobChangeRaise);
        }

        boolean hasEvents() {
            return raise.signum() > 0 || bonus.signum() > 0 || jobChangeRaise.signum() > 0;
        }

        PromotionEvent eventFor(int month, double kindRoll) {
            if (kindRoll < jobChangeProbability) {
                return new PromotionEvent(month, jobChangeRaise, BigDecimal.ZERO, PromotionKind.JOB_CHANGE);
            }
            if (kindRoll < jobChangeProbability + bonusProbability) {
                return new PromotionEvent(month, BigDecimal.ZERO, bonus, PromotionKind.BONUS);
            }
            return new PromotionEvent(month, raise, BigDecimal.ZERO, PromotionKind.PROMOTION);
        }
    }
}
