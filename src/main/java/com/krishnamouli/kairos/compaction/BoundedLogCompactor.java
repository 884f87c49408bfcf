package com.krishnamouli.kairos.compaction;

import com.krishnamouli.kairos.core.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Trims a log to a fixed capacity using a pluggable {@link CompactionPolicy}.
 */
public class BoundedLogCompactor<E extends CompactableEntry> {
    private static final Logger logger = LoggerFactory.getLogger(BoundedLogCompactor.class);

    private final String logName;
    private final int capacity;
    private final CompactionPolicy<E> policy;

    public BoundedLogCompactor(String logName, int capacity, CompactionPolicy<E> policy) {
        if (capacity <= 0) {
            throw new InvalidInputException("capacity must be positive, got " + capacity);
        }
        this.logName = Objects.requireNonNull(logName, "logName");
        this.capacity = capacity;
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param entries log in insertion order
     * @param now     reference time for ages, supplied by the caller
     * @return the input itself when within capacity, otherwise the survivors in
     *         original order
     */
    public List<E> compact(List<E> entries, Instant now) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(now, "now");
        if (entries.size() <= capacity) {
            return entries;
        }

        List<E> survivors = policy.retain(entries, capacity, now);
        logger.debug("Compacted {}: kept {} of {} entries ({} evicted)",
                logName, survivors.size(), entries.size(), entries.size() - survivors.size());
        return survivors;
    }

    public int getCapacity() {
        return capacity;
    }
}
