package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.AnalysisType;

public class StrategyHealth {
    private final String name;
    private final AnalysisType analysisType;
    private final boolean available;
    private final boolean disabled;
    private final double probeLatencyMs;
    private final double averageLatencyMs;
    private final double rollingSuccessRate;
    private final boolean belowSuccessFloor;

    public StrategyHealth(String name, AnalysisType analysisType, boolean available, boolean disabled,
            double probeLatencyMs, double averageLatencyMs, double rollingSuccessRate, boolean belowSuccessFloor) {
        this.name = name;
        this.analysisType = analysisType;
        this.available = available;
        this.disabled = disabled;
        this.probeLatencyMs = probeLatencyMs;
        this.averageLatencyMs = averageLatencyMs;
        this.rollingSuccessRate = rollingSuccessRate;
        this.belowSuccessFloor = belowSuccessFloor;
    }

    public String getName() {
        return name;
    }

    public AnalysisType getAnalysisType() {
        return analysisType;
    }

    public boolean isAvailable() {
        return available;
    }

    public boolean isDisabled() {
        return disabled;
    }

    /** Time taken by the availability probe itself. */
    public double getProbeLatencyMs() {
        return probeLatencyMs;
    }

    public double getAverageLatencyMs() {
        return averageLatencyMs;
    }

    public double getRollingSuccessRate() {
        return rollingSuccessRate;
    }

    /**
     * Reported for external monitoring, which decides whether to disable the strategy. The
     * coordinator never acts on it.
     */
    public boolean isBelowSuccessFloor() {
        return belowSuccessFloor;
    }
}
