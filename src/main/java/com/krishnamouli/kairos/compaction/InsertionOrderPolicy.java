package com.krishnamouli.kairos.compaction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Oldest-first eviction: keeps the most recently inserted entries.
 * For logs whose order carries meaning, such as outcome histories fed to trend detection.
 */
public class InsertionOrderPolicy<E extends CompactableEntry> implements CompactionPolicy<E> {

    @Override
    public List<E> retain(List<E> entries, int capacity, Instant now) {
        int from = Math.max(0, entries.size() - capacity);
        return new ArrayList<>(entries.subList(from, entries.size()));
    }
}
