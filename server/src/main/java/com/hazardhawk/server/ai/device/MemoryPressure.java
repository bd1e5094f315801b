package com.hazardhawk.server.ai.device;

public enum MemoryPressure {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(MemoryPressure other) {
        return compareTo(other) >= 0;
    }
}
