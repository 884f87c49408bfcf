package com.krishnamouli.kairos.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.krishnamouli.kairos.core.InvalidInputException;
import com.krishnamouli.kairos.intelligence.semantic.IdfWeighting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runtime tuning for the relevance engine.
 * Starts from {@link RelevanceConfiguration} defaults; may be loaded from a JSON file
 * whose property names match the setters.
 */
public class KairosConfig {
    private static final Logger logger = LoggerFactory.getLogger(KairosConfig.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        RelevanceConfiguration.validate();
    }

    // Decay
    private double halfLifeDays = RelevanceConfiguration.DEFAULT_HALF_LIFE_DAYS;

    // Confidence
    private double confidenceLevel = RelevanceConfiguration.DEFAULT_CONFIDENCE_LEVEL;
    private double riskThreshold = RelevanceConfiguration.DEFAULT_RISK_THRESHOLD;

    // Relevance index
    private IdfWeighting idfWeighting = IdfWeighting.SMOOTHED;
    private double neutralBoost = RelevanceConfiguration.NEUTRAL_BOOST;
    private int boostCandidateMultiplier = RelevanceConfiguration.BOOST_CANDIDATE_MULTIPLIER;

    // Composite risk
    private int trendWindowSize = RelevanceConfiguration.DEFAULT_TREND_WINDOW;
    private double failureWeight = RelevanceConfiguration.FAILURE_WEIGHT;
    private double trendWeight = RelevanceConfiguration.TREND_WEIGHT;
    private double externalWeight = RelevanceConfiguration.EXTERNAL_WEIGHT;

    public static KairosConfig defaults() {
        return new KairosConfig();
    }

    /**
     * Reads a config file. Properties left out keep their defaults; unknown
     * properties are rejected.
     */
    public static KairosConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            KairosConfig config = fromJson(in);
            logger.info("Loaded configuration from {}: {}", path, config);
            return config;
        }
    }

    public static KairosConfig fromJson(InputStream in) throws IOException {
        KairosConfig config = MAPPER.readValue(in, KairosConfig.class);
        config.validate();
        return config;
    }

    public void validate() {
        if (!(halfLifeDays > 0) || Double.isInfinite(halfLifeDays)) {
            throw new InvalidInputException("halfLifeDays must be positive and finite, got " + halfLifeDays);
        }
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new InvalidInputException("confidenceLevel must be in (0, 1), got " + confidenceLevel);
        }
        if (!(riskThreshold >= 0 && riskThreshold <= 1)) {
            throw new InvalidInputException("riskThreshold must be in [0, 1], got " + riskThreshold);
        }
        if (idfWeighting == null) {
            throw new InvalidInputException("idfWeighting must be set");
        }
        if (!(neutralBoost > 0 && neutralBoost <= 1)) {
            throw new InvalidInputException("neutralBoost must be in (0, 1], got " + neutralBoost);
        }
        if (boostCandidateMultiplier < 1) {
            throw new InvalidInputException("boostCandidateMultiplier must be at least 1");
        }
        if (trendWindowSize < 1) {
            throw new InvalidInputException("trendWindowSize must be at least 1");
        }
        if (failureWeight < 0 || trendWeight < 0 || externalWeight < 0) {
            throw new InvalidInputException("Risk weights must be non-negative");
        }
        double sum = failureWeight + trendWeight + externalWeight;
        if (Math.abs(sum - 1.0) > RelevanceConfiguration.WEIGHT_SUM_TOLERANCE) {
            throw new InvalidInputException("Risk weights must sum to 1, got " + sum);
        }
    }

    // Getters and setters
    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public void setHalfLifeDays(double halfLifeDays) {
        this.halfLifeDays = halfLifeDays;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public void setConfidenceLevel(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
    }

    public double getRiskThreshold() {
        return riskThreshold;
    }

    public void setRiskThreshold(double riskThreshold) {
        this.riskThreshold = riskThreshold;
    }

    public IdfWeighting getIdfWeighting() {
        return idfWeighting;
    }

    public void setIdfWeighting(IdfWeighting idfWeighting) {
        this.idfWeighting = idfWeighting;
    }

    public double getNeutralBoost() {
        return neutralBoost;
    }

    public void setNeutralBoost(double neutralBoost) {
        this.neutralBoost = neutralBoost;
    }

    public int getBoostCandidateMultiplier() {
        return boostCandidateMultiplier;
    }

    public void setBoostCandidateMultiplier(int boostCandidateMultiplier) {
        this.boostCandidateMultiplier = boostCandidateMultiplier;
    }

    public int getTrendWindowSize() {
        return trendWindowSize;
    }

    public void setTrendWindowSize(int trendWindowSize) {
        this.trendWindowSize = trendWindowSize;
    }

    public double getFailureWeight() {
        return failureWeight;
    }

    public void setFailureWeight(double failureWeight) {
        this.failureWeight = failureWeight;
    }

    public double getTrendWeight() {
        return trendWeight;
    }

    public void setTrendWeight(double trendWeight) {
        this.trendWeight = trendWeight;
    }

    public double getExternalWeight() {
        return externalWeight;
    }

    public void setExternalWeight(double externalWeight) {
        this.externalWeight = externalWeight;
    }

    @Override
    public String toString() {
        return String.format(
                "KairosConfig{halfLife=%.1fd, level=%.2f, idf=%s, neutralBoost=%.2f, weights=%.2f/%.2f/%.2f}",
                halfLifeDays, confidenceLevel, idfWeighting, neutralBoost,
                failureWeight, trendWeight, externalWeight);
    }
}
