package com.gillianbc.networth.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Input to a forecast at the service boundary. Everything except the profile is optional:
 * months, variant and seed fall back to the configured defaults.
 */
@Getter
@Builder
@ToString
public class ForecastRequest {

    private final FinancialProfile profile;
    @Singular
    private final List<ScenarioDelta> deltas;
    private final Integer months;
    private final String variant;
    private final Long seed;
}
