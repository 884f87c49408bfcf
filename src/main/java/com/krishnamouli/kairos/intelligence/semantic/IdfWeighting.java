package com.krishnamouli.kairos.intelligence.semantic;

/**
 * Inverse document frequency formulas. Both are strictly decreasing in the
 * document frequency and yield 0 for an empty corpus.
 */
public enum IdfWeighting {

    /**
     * {@code ln(N / (1 + df))}. Non-positive for tokens present in every
     * document, so those never contribute weight.
     */
    STANDARD {
        @Override
        public double idf(int documentCount, int documentFrequency) {
            if (documentCount == 0) {
                return 0.0;
            }
            return Math.log((double) documentCount / (1 + documentFrequency));
        }
    },

    /**
     * {@code ln((N + 1) / (1 + df))}. Positive for every token missing from at
     * least one document, which keeps two- and three-document corpora usable.
     */
    SMOOTHED {
        @Override
        public double idf(int documentCount, int documentFrequency) {
            if (documentCount == 0) {
                return 0.0;
            }
            return Math.log((double) (documentCount + 1) / (1 + documentFrequency));
        }
    };

    public abstract double idf(int documentCount, int documentFrequency);
}
