package com.krishnamouli.kairos.compaction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Keeps the highest-scoring entries. On equal scores the entry inserted later wins.
 */
public abstract class RankedCompactionPolicy<E extends CompactableEntry> implements CompactionPolicy<E> {

    protected abstract double score(E entry, Instant now);

    @Override
    public List<E> retain(List<E> entries, int capacity, Instant now) {
        int n = entries.size();
        double[] scores = new double[n];
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            scores[i] = score(entries.get(i), now);
            order.add(i);
        }

        order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed()
                .thenComparing(Comparator.<Integer>reverseOrder()));

        List<Integer> kept = new ArrayList<>(order.subList(0, Math.min(capacity, n)));
        kept.sort(Comparator.naturalOrder());

        List<E> survivors = new ArrayList<>(kept.size());
        for (int index : kept) {
            survivors.add(entries.get(index));
        }
        return survivors;
    }
}
