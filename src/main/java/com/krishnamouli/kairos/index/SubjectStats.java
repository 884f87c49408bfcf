package com.krishnamouli.kairos.index;

import com.krishnamouli.kairos.core.InvalidInputException;
import com.krishnamouli.kairos.intelligence.bayes.BetaConfidenceEstimator;

/**
 * Observed outcomes for one subject, e.g. how often a skill was injected and
 * how often the task then succeeded.
 */
public class SubjectStats {
    public final long successes;
    public final long total;

    public SubjectStats(long successes, long total) {
        if (successes < 0 || total < successes) {
            throw new InvalidInputException(
                    "Invalid stats: successes=" + successes + ", total=" + total);
        }
        this.successes = successes;
        this.total = total;
    }

    public boolean hasObservations() {
        return total > 0;
    }

    public BetaConfidenceEstimator toEstimator() {
        return BetaConfidenceEstimator.fromStats(successes, total);
    }

    @Override
    public String toString() {
        return successes + "/" + total;
    }
}
