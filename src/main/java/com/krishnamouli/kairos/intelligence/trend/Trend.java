package com.krishnamouli.kairos.intelligence.trend;

/**
 * Result of a monotonic trend test: Kendall's tau in [-1, 1] and its label.
 */
public class Trend {
    public static final Trend NONE = new Trend(0.0, TrendDirection.STABLE);

    public final double tau;
    public final TrendDirection direction;

    public Trend(double tau, TrendDirection direction) {
        this.tau = tau;
        this.direction = direction;
    }

    @Override
    public String toString() {
        return String.format("Trend{tau=%.4f, %s}", tau, direction.label());
    }
}
