package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.AnalysisType;

/**
 * What happened to one strategy during one cascade.
 */
public class StrategyAttempt {

    public enum Outcome {
        SKIPPED_DISABLED,
        SKIPPED_UNAVAILABLE,
        SKIPPED_TIER,
        FAILED,
        TIMED_OUT,
        SUCCEEDED;

        public boolean isSkipped() {
            return this == SKIPPED_DISABLED || this == SKIPPED_UNAVAILABLE || this == SKIPPED_TIER;
        }
    }

    private final String strategyName;
    private final AnalysisType analysisType;
    private final Outcome outcome;
    private final long elapsedMs;
    private final Throwable error;

    public StrategyAttempt(String strategyName, AnalysisType analysisType, Outcome outcome, long elapsedMs,
            Throwable error) {
        this.strategyName = strategyName;
        this.analysisType = analysisType;
        this.outcome = outcome;
        this.elapsedMs = elapsedMs;
        this.error = error;
    }

    static StrategyAttempt skipped(String strategyName, AnalysisType analysisType, Outcome outcome) {
        return new StrategyAttempt(strategyName, analysisType, outcome, 0, null);
    }

    public String getStrategyName() {
        return strategyName;
    }

    public AnalysisType getAnalysisType() {
        return analysisType;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        switch (outcome) {
            case SKIPPED_DISABLED:
                return strategyName + " (disabled)";
            case SKIPPED_UNAVAILABLE:
                return strategyName + " (unavailable)";
            case SKIPPED_TIER:
                return strategyName + " (device tier too low)";
            case SUCCEEDED:
                return strategyName + " (succeeded in " + elapsedMs + "ms)";
            default:
                return strategyName + " (" + outcome + " after " + elapsedMs + "ms"
                        + (error != null ? ": " + error.getMessage() : "") + ")";
        }
    }
}
