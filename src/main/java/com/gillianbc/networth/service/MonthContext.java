package com.gillianbc.networth.service;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Random;

/**
 * Read-only facts about the month being stepped, handed to the variant policy.
 */
@Getter
public final class MonthContext {

    private final int month;
    private final int horizonMonths;
    private final BigDecimal adjustedExpenses;
    private final Random marketRandom;
    private final Random eventRandom;

    MonthContext(int month, int horizonMonths, BigDecimal adjustedExpenses, Random marketRandom, Random eventRandom) {
        this.month = month;
        this.horizonMonths = horizonMonths;
        this.adjustedExpenses = adjustedExpenses;
        this.marketRandom = marketRandom;
        this.eventRandom = eventRandom;
    }

    /**
     * @return 1 for January through 12 for December, taking month 1 as January
     */
    public int calendarMonth() {
        return calendarMonth(month);
    }

    public static int calendarMonth(int month) {
        return (month - 1) % 12 + 1;
    }
}
