package com.hazardhawk.server.ai.device;

/**
 * Ordered from coolest to hottest.
 */
public enum ThermalState {
    NOMINAL,
    LIGHT_THROTTLING,
    MODERATE_THROTTLING,
    SEVERE_THROTTLING,
    CRITICAL_THROTTLING;

    public boolean isAtLeast(ThermalState other) {
        return compareTo(other) >= 0;
    }

    public static ThermalState hottest(ThermalState a, ThermalState b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
