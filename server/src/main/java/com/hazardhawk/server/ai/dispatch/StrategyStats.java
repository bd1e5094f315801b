package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.AnalysisType;

/**
 * Counters for one strategy type at the moment of a snapshot.
 */
public class StrategyStats {
    private final AnalysisType analysisType;
    private final long successes;
    private final long failures;
    private final long timeouts;
    private final long skipped;
    private final long totalLatencyMs;
    private final int rollingSamples;
    private final int rollingSuccesses;

    public StrategyStats(AnalysisType analysisType, long successes, long failures, long timeouts, long skipped,
            long totalLatencyMs, int rollingSamples, int rollingSuccesses) {
        this.analysisType = analysisType;
        this.successes = successes;
        this.failures = failures;
        this.timeouts = timeouts;
        this.skipped = skipped;
        this.totalLatencyMs = totalLatencyMs;
        this.rollingSamples = rollingSamples;
        this.rollingSuccesses = rollingSuccesses;
    }

    public static StrategyStats empty(AnalysisType analysisType) {
        return new StrategyStats(analysisType, 0, 0, 0, 0, 0, 0, 0);
    }

    public AnalysisType getAnalysisType() {
        return analysisType;
    }

    public long getSuccesses() {
        return successes;
    }

    public long getFailures() {
        return failures;
    }

    public long getTimeouts() {
        return timeouts;
    }

    public long getSkipped() {
        return skipped;
    }

    public long getTotalLatencyMs() {
        return totalLatencyMs;
    }

    /** Successes, failures and timeouts; skips are not attempts. */
    public long getAttempts() {
        return successes + failures + timeouts;
    }

    public double getSuccessRate() {
        long attempts = getAttempts();
        return attempts == 0 ? 0.0 : (double) successes / attempts;
    }

    public double getAverageLatencyMs() {
        long attempts = getAttempts();
        return attempts == 0 ? 0.0 : (double) totalLatencyMs / attempts;
    }

    public int getRollingSamples() {
        return rollingSamples;
    }

    /** Success rate over the rolling window; 0 when nothing has been recorded yet. */
    public double getRollingSuccessRate() {
        return rollingSamples == 0 ? 0.0 : (double) rollingSuccesses / rollingSamples;
    }

    @Override
    public String toString() {
        return analysisType + "{ok=" + successes + ", failed=" + failures + ", timedOut=" + timeouts
                + ", skipped=" + skipped + ", avgMs=" + String.format("%.1f", getAverageLatencyMs()) + '}';
    }
}
