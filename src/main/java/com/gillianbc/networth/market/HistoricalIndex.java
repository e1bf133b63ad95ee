package com.gillianbc.networth.market;

import java.util.List;
import java.util.Map;

/**
 * Static month-start closes for the two indices blended into the combined market sample,
 * in chronological order (oldest first), together with the assumptions used to extrapolate
 * each phase of the market cycle beyond the dataset: an annual return, spread evenly over
 * the months, and a volatility band applied as-is to each month's jitter.
 */
public enum HistoricalIndex {

    SP500(0.15,
            Map.of(
                    CyclePhase.RECOVERY, new double[]{0.12, 0.20},
                    CyclePhase.BOOM, new double[]{0.15, 0.12},
                    CyclePhase.BUST, new double[]{-0.05, 0.25},
                    CyclePhase.PLATEAU, new double[]{0.08, 0.15}),
            List.of(
                    IndexClose.of("2024-11-01", 6032.38),
                    IndexClose.of("2024-12-01", 5881.63),
                    IndexClose.of("2025-01-01", 6040.53),
                    IndexClose.of("2025-02-01", 5954.50),
                    IndexClose.of("2025-03-01", 5611.85),
                    IndexClose.of("2025-04-01", 5569.06),
                    IndexClose.of("2025-05-01", 5911.69),
                    IndexClose.of("2025-06-01", 6204.95),
                    IndexClose.of("2025-07-01", 6339.39),
                    IndexClose.of("2025-08-01", 6460.26),
                    IndexClose.of("2025-09-01", 6688.46),
                    IndexClose.of("2025-10-01", 6715.79))),

    // NASDAQ is the more volatile of the two, with higher cycle returns
    NASDAQ(0.20,
            Map.of(
                    CyclePhase.RECOVERY, new double[]{0.15, 0.25},
                    CyclePhase.BOOM, new double[]{0.18, 0.15},
                    CyclePhase.BUST, new double[]{-0.08, 0.30},
                    CyclePhase.PLATEAU, new double[]{0.10, 0.20}),
            List.of(
                    IndexClose.of("2024-11-01", 22780.51),
                    IndexClose.of("2024-12-01", 22780.51),
                    IndexClose.of("2025-01-01", 22780.51),
                    IndexClose.of("2025-02-01", 22780.51),
                    IndexClose.of("2025-03-01", 17299.29),
                    IndexClose.of("2025-04-01", 17299.29),
                    IndexClose.of("2025-05-01", 22780.51),
                    IndexClose.of("2025-06-01", 22780.51),
                    IndexClose.of("2025-07-01", 22780.51),
                    IndexClose.of("2025-08-01", 22780.51),
                    IndexClose.of("2025-09-01", 22780.51),
                    IndexClose.of("2025-10-01", 22780.51)));

    private static final double MONTHS_PER_YEAR = 12.0;

    private final double defaultVolatility;
    private final Map<CyclePhase, double[]> cycleAssumptions;
    private final List<IndexClose> closes;

    HistoricalIndex(double defaultVolatility, Map<CyclePhase, double[]> cycleAssumptions, List<IndexClose> closes) {
        this.defaultVolatility = defaultVolatility;
        this.cycleAssumptions = cycleAssumptions;
        this.closes = closes;
    }

    /**
     * @return closes, oldest first
     */
    public List<IndexClose> getCloses() {
        return closes;
    }

    /**
     * Volatility reported when the trailing returns give no usable estimate.
     */
    public double defaultVolatility() {
        return defaultVolatility;
    }

    public double monthlyReturn(CyclePhase phase) {
        return cycleAssumptions.get(phase)[0] / MONTHS_PER_YEAR;
    }

    /**
     * Jitter bound for a month in the given phase; also the volatility reported for it.
     */
    public double volatility(CyclePhase phase) {
        return cycleAssumptions.get(phase)[1];
    }
}
