package com.krishnamouli.kairos.intelligence.semantic;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable token to weight mapping. Only strictly positive weights are stored;
 * an absent token has weight 0.
 */
public final class SparseVector {
    private static final SparseVector EMPTY = new SparseVector(Map.of(), 0.0);

    private final Map<String, Double> weights;
    private final double norm;

    private SparseVector(Map<String, Double> weights, double norm) {
        this.weights = weights;
        this.norm = norm;
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    /**
     * Copies the given weights, dropping every entry that is not strictly positive.
     */
    @JsonCreator
    public static SparseVector of(Map<String, Double> weights) {
        Objects.requireNonNull(weights, "weights");
        Map<String, Double> kept = new LinkedHashMap<>();
        double sumSquares = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double weight = entry.getValue();
            if (weight != null && weight > 0.0 && !weight.isInfinite()) {
                kept.put(entry.getKey(), weight);
                sumSquares += weight * weight;
            }
        }
        if (kept.isEmpty()) {
            return EMPTY;
        }
        return new SparseVector(Collections.unmodifiableMap(kept), Math.sqrt(sumSquares));
    }

    public double get(String token) {
        return weights.getOrDefault(token, 0.0);
    }

    public boolean contains(String token) {
        return weights.containsKey(token);
    }

    public Set<String> tokens() {
        return weights.keySet();
    }

    @JsonValue
    public Map<String, Double> asMap() {
        return weights;
    }

    public int size() {
        return weights.size();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    /**
     * L2 norm over all entries.
     */
    public double norm() {
        return norm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SparseVector)) {
            return false;
        }
        return weights.equals(((SparseVector) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "SparseVector" + weights;
    }
}
