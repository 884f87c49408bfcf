package com.krishnamouli.kairos.config;

import com.krishnamouli.kairos.core.InvalidInputException;

/**
 * Centralized defaults for the relevance engine.
 * Externalizes all magic numbers; {@link KairosConfig} starts from these values.
 */
public class RelevanceConfiguration {

    // Vectorizer
    /**
     * Separator joining two adjacent words into a bigram token.
     * Rationale: unigrams only contain [a-z0-9], so '_' can never collide.
     */
    public static final String BIGRAM_SEPARATOR = "_";

    // Confidence estimation
    /**
     * Default two-sided confidence level for intervals (95%).
     */
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    /**
     * Default success-rate threshold for risk scores (50%).
     * Rationale: "more likely to fail than succeed" is the natural alarm line.
     */
    public static final double DEFAULT_RISK_THRESHOLD = 0.5;

    /**
     * Pseudo-counts of the uniform Beta(1, 1) prior.
     */
    public static final double PRIOR_PSEUDO_COUNT = 1.0;

    // Temporal decay
    /**
     * Default half-life in days (30).
     * Rationale: an event from last month counts half as much as one from today.
     */
    public static final double DEFAULT_HALF_LIFE_DAYS = 30.0;

    // Trend detection
    /**
     * Tau magnitude above which a sequence is reported as trending.
     */
    public static final double TREND_TAU_THRESHOLD = 0.5;

    /**
     * Minimum number of observations before a trend claim is made.
     */
    public static final int MIN_TREND_OBSERVATIONS = 3;

    /**
     * Rolling window size for failure-rate and error-diversity series.
     */
    public static final int DEFAULT_TREND_WINDOW = 5;

    // Relevance index
    /**
     * Boost applied to candidates without observed stats.
     * Rationale: the mean of the uniform prior; halves unproven candidates.
     */
    public static final double NEUTRAL_BOOST = 0.5;

    /**
     * Candidate pool multiplier for boosted search (2 x topK).
     * Rationale: wide enough for a proven runner-up to overtake, narrow enough
     * to keep low-similarity noise out.
     */
    public static final int BOOST_CANDIDATE_MULTIPLIER = 2;

    // Composite risk
    /**
     * Weight of the Bayesian failure probability in the composite score.
     */
    public static final double FAILURE_WEIGHT = 0.4;

    /**
     * Weight of the trend severity in the composite score.
     */
    public static final double TREND_WEIGHT = 0.3;

    /**
     * Weight of the external indicator (file risk, debt) in the composite score.
     */
    public static final double EXTERNAL_WEIGHT = 0.3;

    /**
     * Tolerance when checking that risk weights sum to one.
     */
    public static final double WEIGHT_SUM_TOLERANCE = 1e-9;

    /**
     * Composite score below which a project is reported healthy.
     */
    public static final double WARNING_SCORE_THRESHOLD = 30.0;

    /**
     * Composite score at or above which a project is reported critical.
     */
    public static final double CRITICAL_SCORE_THRESHOLD = 60.0;

    // Logging
    /**
     * Maximum length of query text echoed into log lines.
     */
    public static final int STRING_TRUNCATE_LENGTH = 60;

    // Private constructor to prevent instantiation
    private RelevanceConfiguration() {
        throw new AssertionError("Configuration class should not be instantiated");
    }

    /**
     * Validates the defaults on startup.
     * Throws InvalidInputException if a default is out of range.
     */
    public static void validate() {
        if (DEFAULT_CONFIDENCE_LEVEL <= 0 || DEFAULT_CONFIDENCE_LEVEL >= 1) {
            throw new InvalidInputException("DEFAULT_CONFIDENCE_LEVEL must be in (0, 1)");
        }
        if (DEFAULT_HALF_LIFE_DAYS <= 0) {
            throw new InvalidInputException("DEFAULT_HALF_LIFE_DAYS must be positive");
        }
        if (NEUTRAL_BOOST <= 0 || NEUTRAL_BOOST > 1) {
            throw new InvalidInputException("NEUTRAL_BOOST must be in (0, 1]");
        }
        if (BOOST_CANDIDATE_MULTIPLIER < 1) {
            throw new InvalidInputException("BOOST_CANDIDATE_MULTIPLIER must be at least 1");
        }
        double weightSum = FAILURE_WEIGHT + TREND_WEIGHT + EXTERNAL_WEIGHT;
        if (Math.abs(weightSum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new InvalidInputException("Risk weights must sum to 1, got " + weightSum);
        }
        if (WARNING_SCORE_THRESHOLD >= CRITICAL_SCORE_THRESHOLD) {
            throw new InvalidInputException("Invalid risk level thresholds");
        }
    }
}
