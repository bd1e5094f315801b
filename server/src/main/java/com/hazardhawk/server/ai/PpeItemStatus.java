package com.hazardhawk.server.ai;

public enum PpeItemStatus {
    PRESENT,
    MISSING,
    INCORRECT,
    UNKNOWN
}
