package com.gillianbc.networth.model;

public enum InsightType {
    NET_WORTH_INCREASE,
    NET_WORTH_DECREASE,
    EXTRA_SAVINGS,
    DEBT_FREE,
    FASTER_GROWTH
}
