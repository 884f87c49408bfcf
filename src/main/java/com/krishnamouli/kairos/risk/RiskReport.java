package com.krishnamouli.kairos.risk;

import com.krishnamouli.kairos.intelligence.bayes.ConfidenceInterval;
import com.krishnamouli.kairos.intelligence.trend.TrendDirection;

import java.util.Map;

/**
 * Composite risk score with the evidence behind it. Plain data; a reporter
 * renders it without access to any estimator state.
 */
public class RiskReport {
    public final double score;
    public final RiskLevel level;
    public final double failureComponent;
    public final double trendComponent;
    public final double externalComponent;
    /** Probability that the underlying success rate lies below the configured risk threshold. */
    public final double successRisk;
    public final Map<String, ConfidenceInterval> intervals;
    public final Map<String, Double> slopes;
    public final Map<String, TrendDirection> trends;

    public RiskReport(double score, double failureComponent, double trendComponent, double externalComponent,
            double successRisk, Map<String, ConfidenceInterval> intervals, Map<String, Double> slopes,
            Map<String, TrendDirection> trends) {
        this.score = score;
        this.level = RiskLevel.fromScore(score);
        this.failureComponent = failureComponent;
        this.trendComponent = trendComponent;
        this.externalComponent = externalComponent;
        this.successRisk = successRisk;
        this.intervals = Map.copyOf(intervals);
        this.slopes = Map.copyOf(slopes);
        this.trends = Map.copyOf(trends);
    }

    @Override
    public String toString() {
        return String.format("RiskReport{score=%.1f, level=%s, successRisk=%.4f, intervals=%s, slopes=%s}",
                score, level, successRisk, intervals, slopes);
    }
}
