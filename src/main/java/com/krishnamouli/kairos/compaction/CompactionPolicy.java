package com.krishnamouli.kairos.compaction;

import java.time.Instant;
import java.util.List;

/**
 * Strategy interface for choosing which log entries survive compaction.
 */
public interface CompactionPolicy<E extends CompactableEntry> {

    /**
     * Select the entries to keep.
     *
     * @param entries  current log, in insertion order; larger than capacity
     * @param capacity number of entries to keep, positive
     * @param now      reference time for age calculations
     * @return the survivors, in their original relative order
     */
    List<E> retain(List<E> entries, int capacity, Instant now);
}
