package com.krishnamouli.kairos.monitoring;

import org.HdrHistogram.ConcurrentHistogram;
import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Latency and outcome counters for relevance index searches.
 * Uses HdrHistogram for accurate latency tracking.
 */
public class SearchMetrics {
    private static final Logger logger = LoggerFactory.getLogger(SearchMetrics.class);

    private final Histogram latencyHistogram;
    private final AtomicLong searches;
    private final AtomicLong emptyResults;
    private final AtomicLong rebuilds;

    public SearchMetrics() {
        this.latencyHistogram = new ConcurrentHistogram(3600000000L, 3); // 1 hour max, 3 significant digits
        this.searches = new AtomicLong(0);
        this.emptyResults = new AtomicLong(0);
        this.rebuilds = new AtomicLong(0);
    }

    public void recordSearch(long latencyNanos, int resultCount) {
        searches.incrementAndGet();
        if (resultCount == 0) {
            emptyResults.incrementAndGet();
        }
        try {
            latencyHistogram.recordValue(latencyNanos / 1000); // Convert to microseconds
        } catch (ArrayIndexOutOfBoundsException e) {
            logger.warn("Search latency out of bounds: {}ns", latencyNanos);
        }
    }

    public void recordRebuild() {
        rebuilds.incrementAndGet();
    }

    public MetricsSnapshot getSnapshot() {
        return new MetricsSnapshot(
                searches.get(),
                emptyResults.get(),
                rebuilds.get(),
                latencyHistogram.getValueAtPercentile(50.0) / 1000.0, // P50 in ms
                latencyHistogram.getValueAtPercentile(95.0) / 1000.0, // P95 in ms
                latencyHistogram.getValueAtPercentile(99.0) / 1000.0); // P99 in ms
    }

    public void reset() {
        latencyHistogram.reset();
        searches.set(0);
        emptyResults.set(0);
        rebuilds.set(0);
    }

    public static class MetricsSnapshot {
        public final long searches;
        public final long emptyResults;
        public final long rebuilds;
        public final double p50LatencyMs;
        public final double p95LatencyMs;
        public final double p99LatencyMs;

        public MetricsSnapshot(long searches, long emptyResults, long rebuilds,
                double p50LatencyMs, double p95LatencyMs, double p99LatencyMs) {
            this.searches = searches;
            this.emptyResults = emptyResults;
            this.rebuilds = rebuilds;
            this.p50LatencyMs = p50LatencyMs;
            this.p95LatencyMs = p95LatencyMs;
            this.p99LatencyMs = p99LatencyMs;
        }

        public double emptyRate() {
            return searches == 0 ? 0.0 : (double) emptyResults / searches;
        }

        @Override
        public String toString() {
            return String.format("searches=%d, empty=%.1f%%, rebuilds=%d, p50=%.3fms, p99=%.3fms",
                    searches, emptyRate() * 100, rebuilds, p50LatencyMs, p99LatencyMs);
        }
    }
}
