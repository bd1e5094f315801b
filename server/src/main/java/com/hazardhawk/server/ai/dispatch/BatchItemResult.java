package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.SafetyAnalysis;

/**
 * Outcome of one request in a batch; exactly one of analysis and error is set.
 */
public class BatchItemResult {
    private final int index;
    private final SafetyAnalysis analysis;
    private final Throwable error;

    private BatchItemResult(int index, SafetyAnalysis analysis, Throwable error) {
        this.index = index;
        this.analysis = analysis;
        this.error = error;
    }

    public static BatchItemResult success(int index, SafetyAnalysis analysis) {
        return new BatchItemResult(index, analysis, null);
    }

    public static BatchItemResult failure(int index, Throwable error) {
        return new BatchItemResult(index, null, error);
    }

    public int getIndex() {
        return index;
    }

    public boolean isSuccess() {
        return analysis != null;
    }

    public SafetyAnalysis getAnalysis() {
        return analysis;
    }

    public Throwable getError() {
        return error;
    }
}
