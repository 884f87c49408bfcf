package com.krishnamouli.kairos.monitoring;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchMetricsTest {

    @Test
    void testCountsAndEmptyRate() {
        SearchMetrics metrics = new SearchMetrics();
        metrics.recordSearch(1_000_000, 3);
        metrics.recordSearch(2_000_000, 0);
        metrics.recordSearch(3_000_000, 1);
        metrics.recordSearch(4_000_000, 2);
        metrics.recordRebuild();

        SearchMetrics.MetricsSnapshot snapshot = metrics.getSnapshot();
        assertEquals(4, snapshot.searches);
        assertEquals(1, snapshot.emptyResults);
        assertEquals(1, snapshot.rebuilds);
        assertEquals(0.25, snapshot.emptyRate());
    }

    @Test
    void testLatencyPercentiles() {
        SearchMetrics metrics = new SearchMetrics();
        metrics.recordSearch(1_000_000, 1);
        metrics.recordSearch(2_000_000, 1);
        metrics.recordSearch(3_000_000, 1);

        SearchMetrics.MetricsSnapshot snapshot = metrics.getSnapshot();
        assertEquals(2.0, snapshot.p50LatencyMs, 0.01);
        assertEquals(3.0, snapshot.p99LatencyMs, 0.01);
        assertTrue(snapshot.p95LatencyMs >= snapshot.p50LatencyMs);
    }

    @Test
    void testReset() {
        SearchMetrics metrics = new SearchMetrics();
        metrics.recordSearch(500_000, 0);
        metrics.recordRebuild();
        metrics.reset();

        SearchMetrics.MetricsSnapshot snapshot = metrics.getSnapshot();
        assertEquals(0, snapshot.searches);
        assertEquals(0, snapshot.rebuilds);
        assertEquals(0.0, snapshot.emptyRate());
        assertEquals(0.0, snapshot.p99LatencyMs);
    }
}
