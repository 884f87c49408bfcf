package com.krishnamouli.kairos.intelligence.bayes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.krishnamouli.kairos.config.RelevanceConfiguration;
import com.krishnamouli.kairos.core.InvalidInputException;

/**
 * Beta-Bernoulli belief over a latent success probability.
 *
 * <p>State is the pair of pseudo-counts {@code (alpha, beta)}, starting at the
 * uniform prior {@code (1, 1)}. The counters only grow through {@link #update}
 * and fully determine the posterior, so persisting {@code alpha} and
 * {@code beta} is enough to restore an estimator.
 *
 * <p>Not thread-safe: callers owning a shared instance must serialize access.
 */
public class BetaConfidenceEstimator {
    private static final double PRIOR = RelevanceConfiguration.PRIOR_PSEUDO_COUNT;

    private double alpha;
    private double beta;

    public BetaConfidenceEstimator() {
        this.alpha = PRIOR;
        this.beta = PRIOR;
    }

    private BetaConfidenceEstimator(double alpha, double beta) {
        this.alpha = alpha;
        this.beta = beta;
    }

    /**
     * Restores an estimator from persisted counters.
     *
     * @throws InvalidInputException if either counter is not strictly positive and finite
     */
    @JsonCreator
    public static BetaConfidenceEstimator of(@JsonProperty("alpha") double alpha,
                                             @JsonProperty("beta") double beta) {
        if (!(alpha > 0) || !(beta > 0) || Double.isInfinite(alpha) || Double.isInfinite(beta)) {
            throw new InvalidInputException(
                    "Counters must be positive and finite, got alpha=" + alpha + ", beta=" + beta);
        }
        return new BetaConfidenceEstimator(alpha, beta);
    }

    /**
     * Uniform prior updated with {@code successes} out of {@code total} trials.
     *
     * @throws InvalidInputException if a count is negative or {@code total < successes}
     */
    public static BetaConfidenceEstimator fromStats(long successes, long total) {
        if (successes < 0 || total < 0) {
            throw new InvalidInputException(
                    "Counts must be non-negative, got successes=" + successes + ", total=" + total);
        }
        if (total < successes) {
            throw new InvalidInputException(
                    "total (" + total + ") must not be less than successes (" + successes + ")");
        }
        BetaConfidenceEstimator estimator = new BetaConfidenceEstimator();
        estimator.update(successes, total - successes);
        return estimator;
    }

    public void update(double successes, double failures) {
        if (!(successes >= 0) || !(failures >= 0)) {
            throw new InvalidInputException(
                    "Observations must be non-negative, got successes=" + successes + ", failures=" + failures);
        }
        alpha += successes;
        beta += failures;
    }

    public void reset() {
        alpha = PRIOR;
        beta = PRIOR;
    }

    public BetaConfidenceEstimator copy() {
        return new BetaConfidenceEstimator(alpha, beta);
    }

    public double mean() {
        return alpha / (alpha + beta);
    }

    public double variance() {
        double sum = alpha + beta;
        return (alpha * beta) / (sum * sum * (sum + 1));
    }

    public ConfidenceInterval confidenceInterval() {
        return confidenceInterval(RelevanceConfiguration.DEFAULT_CONFIDENCE_LEVEL);
    }

    /**
     * Normal-approximation interval {@code mean ± z * sd}, clamped to [0, 1].
     *
     * @param level two-sided confidence level, strictly between 0 and 1
     * @throws InvalidInputException if level is outside (0, 1)
     */
    public ConfidenceInterval confidenceInterval(double level) {
        if (!(level > 0 && level < 1)) {
            throw new InvalidInputException("Confidence level must be in (0, 1), got " + level);
        }
        double z = NormalDistribution.quantile((1.0 + level) / 2.0);
        double mu = mean();
        double sd = Math.sqrt(variance());
        return new ConfidenceInterval(clamp(mu - z * sd), clamp(mu + z * sd));
    }

    public double riskScore() {
        return riskScore(RelevanceConfiguration.DEFAULT_RISK_THRESHOLD);
    }

    /**
     * Approximate probability that the true rate lies below {@code threshold}.
     */
    public double riskScore(double threshold) {
        double sd = Math.sqrt(variance());
        double z = (threshold - mean()) / sd;
        return clamp(NormalDistribution.cdf(z));
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public String toString() {
        return String.format("Beta(alpha=%.2f, beta=%.2f, mean=%.4f)", alpha, beta, mean());
    }
}
