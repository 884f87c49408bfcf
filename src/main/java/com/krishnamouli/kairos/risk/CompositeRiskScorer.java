package com.krishnamouli.kairos.risk;

import com.krishnamouli.kairos.config.KairosConfig;
import com.krishnamouli.kairos.config.RelevanceConfiguration;
import com.krishnamouli.kairos.intelligence.bayes.BetaConfidenceEstimator;
import com.krishnamouli.kairos.intelligence.bayes.ConfidenceInterval;
import com.krishnamouli.kairos.intelligence.trend.Trend;
import com.krishnamouli.kairos.intelligence.trend.TrendDetector;
import com.krishnamouli.kairos.intelligence.trend.TrendDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.ToDoubleFunction;

/**
 * Combines three independent risk indicators into one score in [0, 100]:
 * the Bayesian failure probability of recent outcomes, the severity of
 * failure and error-diversity trends, and an optional external indicator
 * such as file-level debt.
 */
public class CompositeRiskScorer {
    private static final Logger logger = LoggerFactory.getLogger(CompositeRiskScorer.class);

    public static final String FAILURE_RATE = "failure_rate";
    public static final String ERROR_DIVERSITY = "error_diversity";

    private final KairosConfig config;

    public CompositeRiskScorer(KairosConfig config) {
        config.validate();
        this.config = config;
    }

    public RiskReport score(List<Boolean> outcomes, List<String> errorTypes) {
        return score(outcomes, errorTypes, OptionalDouble.empty());
    }

    public RiskReport score(List<Boolean> outcomes, List<String> errorTypes, FileRiskSummary fileRisks) {
        return score(outcomes, errorTypes, OptionalDouble.of(fileRisks.indicator()));
    }

    /**
     * @param outcomes     success flags in time order
     * @param errorTypes   error type per recorded error, in time order
     * @param externalRisk indicator in [0, 1]; values outside are clamped
     */
    public RiskReport score(List<Boolean> outcomes, List<String> errorTypes, OptionalDouble externalRisk) {
        Objects.requireNonNull(outcomes, "outcomes");
        Objects.requireNonNull(errorTypes, "errorTypes");

        Map<String, ConfidenceInterval> intervals = new LinkedHashMap<>();
        double failureComponent = 0.0;
        long failures = outcomes.stream().filter(success -> !success).count();
        if (!outcomes.isEmpty()) {
            BetaConfidenceEstimator failureRate = BetaConfidenceEstimator.fromStats(failures, outcomes.size());
            failureComponent = failureRate.mean();
            intervals.put(FAILURE_RATE, failureRate.confidenceInterval(config.getConfidenceLevel()));
        }
        // With no outcomes this is the uniform prior's answer
        double successRisk = BetaConfidenceEstimator.fromStats(outcomes.size() - failures, outcomes.size())
                .riskScore(config.getRiskThreshold());

        Map<String, Double> slopes = new LinkedHashMap<>();
        Map<String, TrendDirection> trends = new LinkedHashMap<>();
        List<Double> severities = new ArrayList<>();

        Trend failureTrend = windowTrend(outcomes, CompositeRiskScorer::failureFraction);
        if (failureTrend != null) {
            slopes.put(FAILURE_RATE, round(failureTrend.tau));
            trends.put(FAILURE_RATE, failureTrend.direction);
            // Only a rising failure rate is bad
            severities.add(Math.max(0.0, failureTrend.tau));
        }

        Trend diversityTrend = windowTrend(errorTypes, CompositeRiskScorer::distinctCount);
        if (diversityTrend != null) {
            slopes.put(ERROR_DIVERSITY, round(diversityTrend.tau));
            trends.put(ERROR_DIVERSITY, diversityTrend.direction);
            severities.add(Math.abs(diversityTrend.tau));
        }

        double trendComponent = severities.isEmpty() ? 0.0
                : Math.min(1.0, severities.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));

        double externalComponent = externalRisk.isPresent()
                ? Math.max(0.0, Math.min(1.0, externalRisk.getAsDouble()))
                : 0.0;

        double composite = config.getFailureWeight() * failureComponent
                + config.getTrendWeight() * trendComponent
                + config.getExternalWeight() * externalComponent;
        double score = Math.max(0.0, Math.min(100.0, Math.round(composite * 1000.0) / 10.0));

        logger.debug("Composite risk: failure={}, trend={}, external={} => score={}",
                failureComponent, trendComponent, externalComponent, score);

        return new RiskReport(score, failureComponent, trendComponent, externalComponent,
                successRisk, intervals, slopes, trends);
    }

    private <T> Trend windowTrend(List<T> items, ToDoubleFunction<List<T>> aggregate) {
        int window = config.getTrendWindowSize();
        if (items.size() < window) {
            return null;
        }
        List<Double> series = TrendDetector.slidingWindows(items, window, aggregate);
        if (series.size() < RelevanceConfiguration.MIN_TREND_OBSERVATIONS) {
            return null;
        }
        return TrendDetector.trend(series);
    }

    private static double failureFraction(List<Boolean> window) {
        long failures = window.stream().filter(success -> !success).count();
        return (double) failures / window.size();
    }

    private static double distinctCount(List<String> window) {
        return new HashSet<>(window).size();
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
