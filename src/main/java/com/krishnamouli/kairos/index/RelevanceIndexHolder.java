package com.krishnamouli.kairos.index;

import com.krishnamouli.kairos.config.KairosConfig;
import com.krishnamouli.kairos.monitoring.SearchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the live {@link RelevanceIndex} for one store. Rebuilds happen off to the
 * side and are published with a single reference swap, so searches never see
 * a half-built index.
 */
public class RelevanceIndexHolder {
    private static final Logger logger = LoggerFactory.getLogger(RelevanceIndexHolder.class);

    private final AtomicReference<RelevanceIndex> current;
    private final KairosConfig config;
    private final SearchMetrics metrics;

    public RelevanceIndexHolder(KairosConfig config, SearchMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.current = new AtomicReference<>(RelevanceIndex.build(Map.of(), config));
    }

    public RelevanceIndex rebuild(Map<String, String> namedDocuments) {
        return publish(RelevanceIndex.build(namedDocuments, config));
    }

    public RelevanceIndex rebuildFromKeywords(Map<String, ? extends Collection<String>> keywordMap) {
        return publish(RelevanceIndex.buildFromKeywords(keywordMap, config));
    }

    public List<ScoredName> search(String query, int topK) {
        long start = System.nanoTime();
        List<ScoredName> results = current.get().search(query, topK);
        metrics.recordSearch(System.nanoTime() - start, results.size());
        return results;
    }

    public List<ScoredName> searchWithBoost(String query, int topK, Map<String, SubjectStats> statsByName) {
        long start = System.nanoTime();
        List<ScoredName> results = current.get().searchWithBoost(query, topK, statsByName);
        metrics.recordSearch(System.nanoTime() - start, results.size());
        return results;
    }

    public RelevanceIndex current() {
        return current.get();
    }

    public SearchMetrics getMetrics() {
        return metrics;
    }

    private RelevanceIndex publish(RelevanceIndex next) {
        RelevanceIndex previous = current.getAndSet(next);
        metrics.recordRebuild();
        logger.info("Swapped relevance index: {} -> {} documents", previous.size(), next.size());
        return next;
    }
}
