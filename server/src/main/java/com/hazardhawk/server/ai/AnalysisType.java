package com.hazardhawk.server.ai;

/**
 * Which kind of strategy produced an analysis.
 */
public enum AnalysisType {
    LOCAL_ACCELERATED(false),
    CLOUD(true),
    LOCAL_FALLBACK(false);

    private final boolean requiresNetwork;

    AnalysisType(boolean requiresNetwork) {
        this.requiresNetwork = requiresNetwork;
    }

    public boolean requiresNetwork() {
        return requiresNetwork;
    }
}
