package com.krishnamouli.kairos.intelligence.semantic;

/**
 * Cosine similarity between sparse vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Dot product over shared tokens divided by the product of both full norms.
     * Only the smaller vector is iterated, since most pairs share few tokens.
     *
     * @return similarity in [0, 1]; exactly 0 when either vector is empty
     */
    public static double similarity(SparseVector a, SparseVector b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        SparseVector small = a.size() <= b.size() ? a : b;
        SparseVector large = small == a ? b : a;

        double dotProduct = 0.0;
        for (String token : small.tokens()) {
            if (large.contains(token)) {
                dotProduct += small.get(token) * large.get(token);
            }
        }
        if (dotProduct == 0.0) {
            return 0.0;
        }

        double denominator = a.norm() * b.norm();
        if (denominator == 0.0) {
            return 0.0;
        }
        // Rounding can push identical vectors a hair past 1
        return Math.min(1.0, dotProduct / denominator);
    }
}
