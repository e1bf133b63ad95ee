package com.gillianbc.networth.model;

public enum PromotionKind {
    PROMOTION,
    BONUS,
    JOB_CHANGE
}
