package com.hazardhawk.server.ai.device;

public enum PerformanceTier {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(PerformanceTier other) {
        return compareTo(other) >= 0;
    }
}
