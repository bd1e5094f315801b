package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.DetectionParameters;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;

import java.util.Set;

/**
 * On-device inference engine supplied by the platform layer.
 */
public interface ModelEngine {

    Set<Backend> supportedBackends();

    /**
     * Load the model onto {@code backend}. Reports memory exhaustion either by throwing an
     * {@link AnalysisException} of kind {@link AnalysisErrorKind#OUT_OF_MEMORY} or by letting an
     * {@link OutOfMemoryError} escape.
     */
    void initialize(Backend backend) throws AnalysisException;

    SafetyAnalysis run(byte[] image, WorkType workType, DetectionParameters parameters)
            throws AnalysisException, InterruptedException;

    void release();
}
