package com.gillianbc.networth.model;

public enum Milestone {
    TEN_X_WEALTH,
    MILLIONAIRE,
    MULTI_MILLIONAIRE,
    DEBT_FREE,
    CONSERVATIVE_SAVINGS
}
