package com.krishnamouli.kairos.risk;

import com.krishnamouli.kairos.core.InvalidInputException;

/**
 * Counts of risky files and debt trends, reduced to a single indicator in [0, 1]
 * for the composite risk score.
 */
public class FileRiskSummary {
    private static final double CRITICAL_FILE_WEIGHT = 0.3;
    private static final double WARNING_FILE_WEIGHT = 0.1;
    private static final double HIGH_DEBT_WEIGHT = 0.2;

    public final int criticalFiles;
    public final int warningFiles;
    public final int highDebtTrends;

    public FileRiskSummary(int criticalFiles, int warningFiles, int highDebtTrends) {
        if (criticalFiles < 0 || warningFiles < 0 || highDebtTrends < 0) {
            throw new InvalidInputException("File risk counts must be non-negative");
        }
        this.criticalFiles = criticalFiles;
        this.warningFiles = warningFiles;
        this.highDebtTrends = highDebtTrends;
    }

    public double indicator() {
        double raw = criticalFiles * CRITICAL_FILE_WEIGHT
                + warningFiles * WARNING_FILE_WEIGHT
                + highDebtTrends * HIGH_DEBT_WEIGHT;
        return Math.min(1.0, raw);
    }
}
