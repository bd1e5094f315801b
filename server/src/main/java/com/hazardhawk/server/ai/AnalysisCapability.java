package com.hazardhawk.server.ai;

public enum AnalysisCapability {
    MULTIMODAL_VISION,
    PPE_DETECTION,
    HAZARD_IDENTIFICATION,
    OSHA_COMPLIANCE,
    OFFLINE_ANALYSIS,
    REAL_TIME_PROCESSING,
    HARDWARE_ACCELERATION
}
