package com.krishnamouli.kairos.intelligence.bayes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed interval within [0, 1] around a rate estimate.
 */
public class ConfidenceInterval {
    public final double lower;
    public final double upper;

    @JsonCreator
    public ConfidenceInterval(@JsonProperty("lower") double lower, @JsonProperty("upper") double upper) {
        this.lower = lower;
        this.upper = upper;
    }

    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConfidenceInterval)) {
            return false;
        }
        ConfidenceInterval other = (ConfidenceInterval) o;
        return Double.compare(lower, other.lower) == 0 && Double.compare(upper, other.upper) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(lower) + Double.hashCode(upper);
    }

    @Override
    public String toString() {
        return String.format("[%.4f, %.4f]", lower, upper);
    }
}
