package com.gillianbc.networth.market;

import com.gillianbc.networth.model.MarketSample;
import com.gillianbc.networth.model.MarketTrend;
import com.gillianbc.networth.model.TrendDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Supplies monthly market samples for the realistic projection.
 * <p>
 * Month {@code n} (1-based) of a projection maps to the n-th historical monthly return, computed
 * from the chronological closes of {@link HistoricalIndex}. Past the end of the dataset the month
 * falls into a repeating 84-month cycle (recovery, boom, bust, plateau) whose phase sets the base
 * return and volatility band, plus uniform jitter in {@code [-volatility, +volatility]} drawn from
 * the caller's random source. Historical months never consume random numbers.
 * <p>
 * Instances hold only immutable precomputed samples and are safe to share between threads.
 */
@Slf4j
@Component
public class MarketDataProvider {

    static final double PRIMARY_WEIGHT = 0.6;
    static final double SECONDARY_WEIGHT = 0.4;
    private static final int VOLATILITY_WINDOW = 3;
    private static final int RECESSION_WINDOW = 2;
    private static final double RECESSION_RETURN_THRESHOLD = -0.05;
    private static final int TREND_WINDOW = 6;
    private static final double TREND_RETURN_THRESHOLD = 0.02;

    private final Map<HistoricalIndex, List<MarketSample>> historicalSamples = new EnumMap<>(HistoricalIndex.class);

    public MarketDataProvider() {
        for (HistoricalIndex index : HistoricalIndex.values()) {
            historicalSamples.put(index, Collections.unmodifiableList(computeHistoricalSamples(index)));
        }
    }

    /**
     * @return number of leading months served from the historical dataset
     */
    public int historicalMonths() {
        return Math.min(historicalSamples.get(HistoricalIndex.SP500).size(),
                historicalSamples.get(HistoricalIndex.NASDAQ).size());
    }

    public List<MarketSample> historicalSamples(HistoricalIndex index) {
        return historicalSamples.get(index);
    }

    /**
     * Sample for a single index.
     *
     * @param month  1-based projection month
     * @param random source for extrapolation jitter; untouched for historical months
     */
    public MarketSample sampleFor(HistoricalIndex index, int month, Random random) {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(random, "random must not be null");
        if (month < 1) {
            throw new IllegalArgumentException("month must be >= 1");
        }

        List<MarketSample> history = historicalSamples.get(index);
        if (month <= history.size()) {
            return history.get(month - 1);
        }

        CyclePhase phase = CyclePhase.forMonth(month);
        double volatility = index.volatility(phase);
        double jitter = (random.nextDouble() - 0.5) * 2 * volatility;
        return new MarketSample(month, index.monthlyReturn(phase) + jitter, volatility, phase.isRecession());
    }

    /**
     * 60/40 blend of the S&amp;P 500 and NASDAQ samples; recession if either index is in recession.
     * Draws the primary index before the secondary, so a given random sequence always yields
     * the same samples.
     */
    public MarketSample combinedSampleFor(int month, Random random) {
        MarketSample primary = sampleFor(HistoricalIndex.SP500, month, random);
        MarketSample secondary = sampleFor(HistoricalIndex.NASDAQ, month, random);

        double combinedReturn = primary.getMonthlyReturn() * PRIMARY_WEIGHT + secondary.getMonthlyReturn() * SECONDARY_WEIGHT;
        double combinedVolatility = primary.getVolatility() * PRIMARY_WEIGHT + secondary.getVolatility() * SECONDARY_WEIGHT;
        return new MarketSample(month, combinedReturn, combinedVolatility, primary.isRecession() || secondary.isRecession());
    }

    /**
     * Classifies the trailing six months of S&amp;P 500 history as bull, bear or sideways.
     */
    public MarketTrend currentTrend() {
        List<MarketSample> history = historicalSamples.get(HistoricalIndex.SP500);
        List<MarketSample> recent = history.subList(Math.max(0, history.size() - TREND_WINDOW), history.size());
        if (recent.isEmpty()) {
            return new MarketTrend(TrendDirection.SIDEWAYS, 0.0, 0.5);
        }

        double sum = 0.0;
        int positiveMonths = 0;
        for (MarketSample sample : recent) {
            sum += sample.getMonthlyReturn();
            if (sample.getMonthlyReturn() > 0) {
                positiveMonths++;
            }
        }
        double average = sum / recent.size();

        MarketTrend trend;
        if (average > TREND_RETURN_THRESHOLD && positiveMonths >= 4) {
            trend = new MarketTrend(TrendDirection.BULL, Math.abs(average), 0.8);
        } else if (average < -TREND_RETURN_THRESHOLD && positiveMonths <= 2) {
            trend = new MarketTrend(TrendDirection.BEAR, Math.abs(average), 0.8);
        } else {
            trend = new MarketTrend(TrendDirection.SIDEWAYS, Math.abs(average), 0.6);
        }
        log.debug("Market trend over last {} months: {}", recent.size(), trend);
        return trend;
    }

    private static List<MarketSample> computeHistoricalSamples(HistoricalIndex index) {
        List<IndexClose> closes = index.getCloses();
        List<MarketSample> samples = new ArrayList<>();

        for (int i = 1; i < closes.size(); i++) {
            double previous = closes.get(i - 1).getClose();
            double monthlyReturn = (closes.get(i).getClose() - previous) / previous;

            // Volatility: population standard deviation of up to three preceding returns
            List<MarketSample> window = samples.subList(Math.max(0, samples.size() - VOLATILITY_WINDOW), samples.size());
            double volatility = 0.0;
            if (!window.isEmpty()) {
                double mean = 0.0;
                for (MarketSample s : window) {
                    mean += s.getMonthlyReturn();
                }
                mean /= window.size();
                double variance = 0.0;
                for (MarketSample s : window) {
                    variance += Math.pow(s.getMonthlyReturn() - mean, 2);
                }
                volatility = Math.sqrt(variance / window.size());
            }
            if (volatility == 0.0) {
                volatility = index.defaultVolatility();
            }

            // Recession: sharp drop following negative months
            boolean recession = monthlyReturn < RECESSION_RETURN_THRESHOLD;
            for (MarketSample s : samples.subList(Math.max(0, samples.size() - RECESSION_WINDOW), samples.size())) {
                if (s.getMonthlyReturn() >= 0) {
                    recession = false;
                }
            }

            samples.add(new MarketSample(i, monthlyReturn, volatility, recession));
        }
        return samples;
    }
}
