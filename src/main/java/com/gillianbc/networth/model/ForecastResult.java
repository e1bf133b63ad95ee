package com.gillianbc.networth.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Status-quo projection plus, when scenario deltas were supplied, the what-if projection
 * and the derived comparison.
 */
@Getter
@ToString
public class ForecastResult {

    private final ModelVariant variant;
    private final int months;
    private final long seed;
    private final List<TimelinePoint> statusQuo;
    private final AvatarState statusQuoState;
    @Getter(AccessLevel.NONE)
    private final FinancialProfile whatIfProfile;
    @Getter(AccessLevel.NONE)
    private final List<TimelinePoint> whatIf;
    @Getter(AccessLevel.NONE)
    private final AvatarState whatIfState;
    private final List<Insight> insights;
    @Getter(AccessLevel.NONE)
    private final LongTermSummary longTermSummary;

    public ForecastResult(ModelVariant variant,
                          int months,
                          long seed,
                          List<TimelinePoint> statusQuo,
                          AvatarState statusQuoState,
                          FinancialProfile whatIfProfile,
                          List<TimelinePoint> whatIf,
                          AvatarState whatIfState,
                          List<Insight> insights,
                          LongTermSummary longTermSummary) {
        this.variant = Objects.requireNonNull(variant, "variant must not be null");
        this.months = months;
        this.seed = seed;
        this.statusQuo = List.copyOf(Objects.requireNonNull(statusQuo, "statusQuo must not be null"));
        this.statusQuoState = Objects.requireNonNull(statusQuoState, "statusQuoState must not be null");
        this.whatIfProfile = whatIfProfile;
        this.whatIf = whatIf == null ? null : List.copyOf(whatIf);
        this.whatIfState = whatIfState;
        this.insights = List.copyOf(Objects.requireNonNull(insights, "insights must not be null"));
        this.longTermSummary = longTermSummary;
    }

    public Optional<FinancialProfile> getWhatIfProfile() {
        return Optional.ofNullable(whatIfProfile);
    }

    public Optional<List<TimelinePoint>> getWhatIf() {
        return Optional.ofNullable(whatIf);
    }

    public Optional<AvatarState> getWhatIfState() {
        return Optional.ofNullable(whatIfState);
    }

    public Optional<LongTermSummary> getLongTermSummary() {
        return Optional.ofNullable(longTermSummary);
    }
}
