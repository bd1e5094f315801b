package com.hazardhawk.server.ai;

public enum RiskLevel {
    MINIMAL,
    LOW,
    MODERATE,
    HIGH,
    SEVERE
}
