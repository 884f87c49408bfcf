package com.krishnamouli.kairos.intelligence.decay;

import com.krishnamouli.kairos.core.InvalidInputException;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-life weighting of observations by age.
 *
 * <pre>
 * decay(age, halfLife) = 2^(-age / halfLife) = exp(-ln 2 * age / halfLife)
 * </pre>
 *
 * <p>Ages are supplied by the caller; nothing here reads a clock. Negative ages
 * (future-dated entries) produce multipliers above 1 and are not clamped.
 */
public final class TemporalDecay {
    private static final double SECONDS_PER_DAY = 86_400.0;

    private TemporalDecay() {
    }

    /**
     * @throws InvalidInputException if halfLife is not strictly positive and finite
     */
    public static double decay(double age, double halfLife) {
        if (!(halfLife > 0) || Double.isInfinite(halfLife)) {
            throw new InvalidInputException("halfLife must be positive and finite, got " + halfLife);
        }
        // Base 2 keeps decay(h, h) and decay(2h, h) exact
        return Math.pow(0.5, age / halfLife);
    }

    public static double weightedScore(double base, double age, double halfLife) {
        return base * decay(age, halfLife);
    }

    /**
     * Fractional days elapsed from {@code from} to {@code now}; negative when
     * {@code from} lies in the future.
     */
    public static double ageInDays(Instant from, Instant now) {
        Duration elapsed = Duration.between(from, now);
        return (elapsed.getSeconds() + elapsed.getNano() / 1e9) / SECONDS_PER_DAY;
    }
}
