package com.gillianbc.networth.model;

/**
 * Qualitative wealth tier derived from a single timeline point.
 */
public enum AvatarState {
    STRUGGLING,
    STABLE,
    THRIVING,
    WEALTHY
}
