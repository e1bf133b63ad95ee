package com.gillianbc.networth.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Headline figures for a projection of 20 years or more.
 * Percentages are absent when the starting net worth is zero or negative.
 */
@Getter
@EqualsAndHashCode
@ToString
public class LongTermSummary {

    private final BigDecimal years;
    private final BigDecimal initialNetWorth;
    private final BigDecimal finalNetWorth;
    private final BigDecimal totalGrowth;
    @Getter(AccessLevel.NONE)
    private final BigDecimal totalGrowthPercent;
    @Getter(AccessLevel.NONE)
    private final BigDecimal annualGrowthPercent;
    private final Set<Milestone> milestones;

    public LongTermSummary(BigDecimal years,
                           BigDecimal initialNetWorth,
                           BigDecimal finalNetWorth,
                           BigDecimal totalGrowthPercent,
                           BigDecimal annualGrowthPercent,
                           Set<Milestone> milestones) {
        this.years = Objects.requireNonNull(years, "years must not be null");
        this.initialNetWorth = Objects.requireNonNull(initialNetWorth, "initialNetWorth must not be null");
        this.finalNetWorth = Objects.requireNonNull(finalNetWorth, "finalNetWorth must not be null");
        this.totalGrowth = finalNetWorth.subtract(initialNetWorth);
        this.totalGrowthPercent = totalGrowthPercent;
        this.annualGrowthPercent = annualGrowthPercent;
        Objects.requireNonNull(milestones, "milestones must not be null");
        this.milestones = Collections.unmodifiableSet(
                milestones.isEmpty() ? EnumSet.noneOf(Milestone.class) : EnumSet.copyOf(milestones));
    }

    public Optional<BigDecimal> getTotalGrowthPercent() {
        return Optional.ofNullable(totalGrowthPercent);
    }

    /**
     * @return compound annual growth rate in percent
     */
    public Optional<BigDecimal> getAnnualGrowthPercent() {
        return Optional.ofNullable(annualGrowthPercent);
    }

    public boolean reached(Milestone milestone) {
        return milestones.contains(milestone);
    }
}
