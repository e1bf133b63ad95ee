package com.gillianbc.networth.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

@Getter
@EqualsAndHashCode
@ToString
public class MarketTrend {

    private final TrendDirection direction;
    /**
     * Absolute average monthly return over the trailing window.
     */
    private final double strength;
    private final double confidence;

    public MarketTrend(TrendDirection direction, double strength, double confidence) {
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.strength = strength;
        this.confidence = confidence;
    }
}
