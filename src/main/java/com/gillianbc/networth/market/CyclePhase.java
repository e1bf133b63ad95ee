package com.gillianbc.networth.market;

/**
 * Sub-periods of the 84-month market cycle used once the historical closes run out.
 * Bounds are positions within the cycle, inclusive start and exclusive end.
 */
public enum CyclePhase {
    RECOVERY(0, 12),
    BOOM(12, 36),
    BUST(36, 48),
    PLATEAU(48, 84);

    public static final int CYCLE_MONTHS = 84;

    private final int start;
    private final int end;

    CyclePhase(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public static CyclePhase forMonth(int month) {
        int position = Math.floorMod(month - 1, CYCLE_MONTHS);
        for (CyclePhase phase : values()) {
            if (position >= phase.start && position < phase.end) {
                return phase;
            }
        }
        throw new IllegalStateException("No cycle phase for position " + position);
    }

    public boolean isRecession() {
        return this == BUST;
    }
}
