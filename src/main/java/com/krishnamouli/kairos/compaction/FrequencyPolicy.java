package com.krishnamouli.kairos.compaction;

import java.time.Instant;

/**
 * Keeps the most frequently recurring entries regardless of age.
 */
public class FrequencyPolicy<E extends CompactableEntry> extends RankedCompactionPolicy<E> {

    @Override
    protected double score(E entry, Instant now) {
        return entry.frequency();
    }
}
