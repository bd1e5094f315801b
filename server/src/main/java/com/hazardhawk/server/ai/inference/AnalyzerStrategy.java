package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.AnalysisCapability;
import com.hazardhawk.server.ai.AnalysisType;
import com.hazardhawk.server.ai.DetectionParameters;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.device.PerformanceTier;

import java.util.Set;

/**
 * One way of producing a {@link SafetyAnalysis}. Implementations own their backend resources and
 * must tolerate concurrent {@link #analyze} calls.
 */
public interface AnalyzerStrategy {

    String getName();

    /** Higher runs first. */
    int getPriority();

    Set<AnalysisCapability> getCapabilities();

    AnalysisType getAnalysisType();

    boolean isAvailable();

    /**
     * Analyze the image. Must respond to thread interruption, which is how timeouts and caller
     * aborts cancel the call.
     */
    SafetyAnalysis analyze(byte[] image, WorkType workType) throws AnalysisException, InterruptedException;

    /**
     * @param credential API key or token, may be null for strategies that need none
     */
    void configure(String credential) throws AnalysisException;

    /** Degraded results get their confidence scaled down and a caveat attached. */
    default boolean isDegraded() {
        return false;
    }

    default PerformanceTier getMinimumTier() {
        return PerformanceTier.LOW;
    }

    /** True while the device is hot enough that this strategy runs on a downgraded backend. */
    default boolean isThermallyThrottled() {
        return false;
    }

    default void updateDetectionParameters(DetectionParameters parameters) {
    }
}
