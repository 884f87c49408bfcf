package com.krishnamouli.kairos.intelligence.trend;

import com.krishnamouli.kairos.config.RelevanceConfiguration;
import com.krishnamouli.kairos.core.InvalidInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Simplified Mann-Kendall monotonic trend test.
 * Rank-based, so it ignores the magnitude of changes.
 */
public final class TrendDetector {
    private static final double THRESHOLD = RelevanceConfiguration.TREND_TAU_THRESHOLD;
    private static final int MIN_OBSERVATIONS = RelevanceConfiguration.MIN_TREND_OBSERVATIONS;

    private TrendDetector() {
    }

    /**
     * Classifies an ordered series. Fewer than three values never make a trend claim.
     *
     * @param values observations in time order
     */
    public static Trend trend(List<? extends Number> values) {
        Objects.requireNonNull(values, "values");
        int n = values.size();
        if (n < MIN_OBSERVATIONS) {
            return Trend.NONE;
        }

        long concordant = 0;
        long discordant = 0;
        for (int i = 0; i < n - 1; i++) {
            double vi = values.get(i).doubleValue();
            for (int j = i + 1; j < n; j++) {
                double vj = values.get(j).doubleValue();
                if (vj > vi) {
                    concordant++;
                } else if (vj < vi) {
                    discordant++;
                }
            }
        }

        double totalPairs = (double) n * (n - 1) / 2.0;
        double tau = (concordant - discordant) / totalPairs;

        if (tau > THRESHOLD) {
            return new Trend(tau, TrendDirection.INCREASING);
        } else if (tau < -THRESHOLD) {
            return new Trend(tau, TrendDirection.DECREASING);
        }
        return new Trend(tau, TrendDirection.STABLE);
    }

    public static Trend trend(double... values) {
        List<Double> boxed = new ArrayList<>(values.length);
        for (double value : values) {
            boxed.add(value);
        }
        return trend(boxed);
    }

    /**
     * Aggregates every full window of consecutive items: {@code items.size() - window + 1}
     * values, or none when there are fewer items than the window.
     *
     * @throws InvalidInputException if window is not positive
     */
    public static <T> List<Double> slidingWindows(List<T> items, int window,
                                                  ToDoubleFunction<List<T>> aggregate) {
        if (window < 1) {
            throw new InvalidInputException("window must be positive, got " + window);
        }
        List<Double> series = new ArrayList<>();
        for (int start = 0; start + window <= items.size(); start++) {
            series.add(aggregate.applyAsDouble(items.subList(start, start + window)));
        }
        return series;
    }
}
