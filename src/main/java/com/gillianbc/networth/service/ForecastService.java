package com.gillianbc.networth.service;

import com.gillianbc.networth.config.ProjectionProperties;
import com.gillianbc.networth.model.FinancialProfile;
import com.gillianbc.networth.model.ForecastRequest;
import com.gillianbc.networth.model.ForecastResult;
import com.gillianbc.networth.model.Insight;
import com.gillianbc.networth.model.InvalidProjectionInputException;
import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.model.PromotionEvent;
import com.gillianbc.networth.model.TimelinePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Entry point for callers outside the engine: resolves defaults, clamps the horizon, runs the
 * status-quo and (when deltas are given) the what-if projection under one seed and one promotion
 * schedule, and derives the tiers and insights.
 */
@Slf4j
@Service
public class ForecastService {

    private final ProjectionEngine projectionEngine;
    private final ScenarioService scenarioService;
    private final PromotionScheduler promotionScheduler;
    private final WealthClassifier wealthClassifier;
    private final InsightService insightService;
    private final ProjectionProperties properties;

    public ForecastService(ProjectionEngine projectionEngine,
                           ScenarioService scenarioService,
                           PromotionScheduler promotionScheduler,
                           WealthClassifier wealthClassifier,
                           InsightService insightService,
                           ProjectionProperties properties) {
        this.projectionEngine = Objects.requireNonNull(projectionEngine, "projectionEngine must not be null");
        this.scenarioService = Objects.requireNonNull(scenarioService, "scenarioService must not be null");
        this.promotionScheduler = Objects.requireNonNull(promotionScheduler, "promotionScheduler must not be null");
        this.wealthClassifier = Objects.requireNonNull(wealthClassifier, "wealthClassifier must not be null");
        this.insightService = Objects.requireNonNull(insightService, "insightService must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * @throws InvalidProjectionInputException if the profile (or the what-if profile) is invalid
     *                                         or the variant name is unknown
     */
    public ForecastResult forecast(ForecastRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (request.getProfile() == null) {
            throw new InvalidProjectionInputException("Financial profile is required");
        }
        ProfileValidator.validateProfile(request.getProfile());

        int months = resolveMonths(request.getMonths());
        ModelVariant variant = ModelVariant.fromWireName(
                request.getVariant() != null ? request.getVariant() : properties.defaultVariant());
        long seed = resolveSeed(request.getSeed());
        List<PromotionEvent> schedule = promotionScheduler.schedule(months, variant, seed);

        log.info("Forecast: {} months, {} model, {} scenario deltas", months, variant.wireName(), request.getDeltas().size());

        List<TimelinePoint> statusQuo = projectionEngine.project(request.getProfile(), months, variant, seed, schedule);
        TimelinePoint statusQuoFinal = statusQuo.get(statusQuo.size() - 1);

        if (request.getDeltas().isEmpty()) {
            return new ForecastResult(variant, months, seed, statusQuo, wealthClassifier.classify(statusQuoFinal),
                    null, null, null, List.of(), insightService.summarizeLongTerm(statusQuo).orElse(null));
        }

        FinancialProfile whatIfProfile = scenarioService.apply(request.getProfile(), request.getDeltas());
        List<TimelinePoint> whatIf = projectionEngine.project(whatIfProfile, months, variant, seed, schedule);
        List<Insight> insights = insightService.compare(statusQuo, whatIf);

        return new ForecastResult(variant, months, seed, statusQuo, wealthClassifier.classify(statusQuoFinal),
                whatIfProfile, whatIf, wealthClassifier.classify(whatIf.get(whatIf.size() - 1)),
                insights, insightService.summarizeLongTerm(statusQuo).orElse(null));
    }

    /**
     * Missing means the configured default; anything else is clamped to {@code [1, maxMonths]}.
     */
    int resolveMonths(Integer requested) {
        if (requested == null) {
            return Math.min(properties.defaultMonths(), properties.maxMonths());
        }
        return Math.min(Math.max(requested, 1), properties.maxMonths());
    }

    private long resolveSeed(Long requested) {
        if (requested != null) {
            return requested;
        }
        if (properties.seed() != null) {
            return properties.seed();
        }
        return ThreadLocalRandom.current().nextLong();
    }
}
