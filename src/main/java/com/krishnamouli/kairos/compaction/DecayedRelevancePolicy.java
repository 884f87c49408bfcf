package com.krishnamouli.kairos.compaction;

import com.krishnamouli.kairos.config.KairosConfig;
import com.krishnamouli.kairos.core.InvalidInputException;
import com.krishnamouli.kairos.intelligence.decay.TemporalDecay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Keeps entries by {@code decay(ageDays, halfLife) * (1 + frequency)}, so a
 * frequently recurring but older entry can outrank a recent one-off.
 */
public class DecayedRelevancePolicy<E extends CompactableEntry> extends RankedCompactionPolicy<E> {
    private static final Logger logger = LoggerFactory.getLogger(DecayedRelevancePolicy.class);

    private final double halfLifeDays;

    public DecayedRelevancePolicy(double halfLifeDays) {
        if (!(halfLifeDays > 0) || Double.isInfinite(halfLifeDays)) {
            throw new InvalidInputException("halfLifeDays must be positive and finite, got " + halfLifeDays);
        }
        this.halfLifeDays = halfLifeDays;
    }

    public DecayedRelevancePolicy(KairosConfig config) {
        this(config.getHalfLifeDays());
    }

    public double relevance(E entry, Instant now) {
        double ageDays = TemporalDecay.ageInDays(entry.timestamp(), now);
        return TemporalDecay.weightedScore(1.0 + entry.frequency(), ageDays, halfLifeDays);
    }

    @Override
    protected double score(E entry, Instant now) {
        double relevance = relevance(entry, now);
        logger.trace("Relevance of {}: {}", entry, relevance);
        return relevance;
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }
}
