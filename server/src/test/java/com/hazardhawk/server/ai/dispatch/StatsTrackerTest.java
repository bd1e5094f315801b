package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.AnalysisType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StatsTrackerTest {

    @Test
    public void testCountersAndDerivedValues() {
        StatsTracker tracker = new StatsTracker(50);
        tracker.recordRequest();
        tracker.recordRequest();
        tracker.recordCacheHit();
        tracker.recordSuccess(AnalysisType.CLOUD, 100);
        tracker.recordSuccess(AnalysisType.CLOUD, 300);
        tracker.recordFailure(AnalysisType.LOCAL_ACCELERATED, 50);
        tracker.recordTimeout(AnalysisType.LOCAL_ACCELERATED, 250);
        tracker.recordSkipped(AnalysisType.LOCAL_FALLBACK);

        OrchestratorStats stats = tracker.snapshot();
        StrategyStats cloud = stats.forType(AnalysisType.CLOUD);
        assertEquals(2, cloud.getSuccesses());
        assertEquals(200.0, cloud.getAverageLatencyMs(), 1e-9);
        assertEquals(1.0, cloud.getSuccessRate(), 1e-9);

        StrategyStats local = stats.forType(AnalysisType.LOCAL_ACCELERATED);
        assertEquals(1, local.getFailures());
        assertEquals(1, local.getTimeouts());
        assertEquals(0.0, local.getRollingSuccessRate(), 1e-9);
        assertEquals(1, stats.forType(AnalysisType.LOCAL_FALLBACK).getSkipped());
        assertEquals(0, stats.forType(AnalysisType.LOCAL_FALLBACK).getAttempts());

        assertEquals(AnalysisType.CLOUD, stats.getPreferredStrategy());
        assertEquals(0.5, stats.getOverallSuccessRate(), 1e-9);
        assertEquals(0.5, stats.getCacheHitRate(), 1e-9);
        assertEquals(175.0, stats.getAverageLatencyMs(), 1e-9);
    }

    @Test
    public void testRollingWindowForgetsOldOutcomes() {
        StatsTracker tracker = new StatsTracker(4);
        for (int i = 0; i < 4; i++) {
            tracker.recordFailure(AnalysisType.CLOUD, 10);
        }
        for (int i = 0; i < 3; i++) {
            tracker.recordSuccess(AnalysisType.CLOUD, 10);
        }

        StrategyStats cloud = tracker.snapshot().forType(AnalysisType.CLOUD);
        assertEquals(4, cloud.getRollingSamples());
        assertEquals(0.75, cloud.getRollingSuccessRate(), 1e-9);
        assertEquals(3.0 / 7.0, cloud.getSuccessRate(), 1e-9);
    }

    @Test
    public void testSnapshotIsDetachedAndResetClears() {
        StatsTracker tracker = new StatsTracker(10);
        tracker.recordSuccess(AnalysisType.LOCAL_FALLBACK, 5);
        OrchestratorStats before = tracker.snapshot();

        tracker.recordSuccess(AnalysisType.LOCAL_FALLBACK, 5);
        assertEquals(1, before.forType(AnalysisType.LOCAL_FALLBACK).getSuccesses());

        tracker.reset();
        OrchestratorStats after = tracker.snapshot();
        assertEquals(0, after.getTotalSuccesses());
        assertEquals(0, after.forType(AnalysisType.LOCAL_FALLBACK).getRollingSamples());
        assertNull(after.getPreferredStrategy());
    }
}
