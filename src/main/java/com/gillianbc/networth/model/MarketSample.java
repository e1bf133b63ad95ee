package com.gillianbc.networth.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One month of index behaviour: fractional monthly return, monthly volatility and a recession flag.
 */
@Getter
@EqualsAndHashCode
@ToString
public class MarketSample {

    private final int month;
    private final double monthlyReturn;
    private final double volatility;
    private final boolean recession;

    public MarketSample(int month, double monthlyReturn, double volatility, boolean recession) {
        this.month = month;
        this.monthlyReturn = monthlyReturn;
        this.volatility = volatility;
        this.recession = recession;
    }
}
