package com.hazardhawk.server.ai;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
