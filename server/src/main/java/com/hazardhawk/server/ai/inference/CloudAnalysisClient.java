package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;

/**
 * Remote vision service; owns its transport and wire format.
 */
public interface CloudAnalysisClient {

    void configure(String credential) throws AnalysisException;

    boolean isConfigured();

    SafetyAnalysis analyze(byte[] image, WorkType workType) throws AnalysisException, InterruptedException;
}
