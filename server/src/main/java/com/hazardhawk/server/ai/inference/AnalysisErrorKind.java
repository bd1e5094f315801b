package com.hazardhawk.server.ai.inference;

public enum AnalysisErrorKind {
    /** Strategy never became usable. */
    CONFIGURATION,
    /** Strategy skipped, not attempted. */
    UNAVAILABLE,
    TIMEOUT,
    /** Backend forced down or refused because the device is too hot. */
    THERMAL_THROTTLING,
    OUT_OF_MEMORY,
    /** Strategy ran and reported a domain error. */
    INFERENCE,
    ALL_STRATEGIES_EXHAUSTED
}
