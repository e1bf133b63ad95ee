package com.gillianbc.networth.model;

public enum TrendDirection {
    BULL,
    BEAR,
    SIDEWAYS
}
