package com.krishnamouli.kairos.risk;

import com.krishnamouli.kairos.config.RelevanceConfiguration;

public enum RiskLevel {
    HEALTHY, WARNING, CRITICAL;

    public static RiskLevel fromScore(double score) {
        if (score < RelevanceConfiguration.WARNING_SCORE_THRESHOLD) {
            return HEALTHY;
        }
        if (score < RelevanceConfiguration.CRITICAL_SCORE_THRESHOLD) {
            return WARNING;
        }
        return CRITICAL;
    }
}
