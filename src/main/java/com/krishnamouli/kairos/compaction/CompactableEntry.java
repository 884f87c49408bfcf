package com.krishnamouli.kairos.compaction;

import java.time.Instant;

/**
 * A record in a bounded log: an error, a delegation outcome, a learned pattern.
 */
public interface CompactableEntry {

    /**
     * Frequency assumed for logs that do not count recurrences.
     */
    long UNTRACKED_FREQUENCY = 1;

    /**
     * When the entry was recorded, or last seen for recurring entries.
     */
    Instant timestamp();

    /**
     * How many times the entry recurred.
     */
    default long frequency() {
        return UNTRACKED_FREQUENCY;
    }
}
