package com.hazardhawk.server.ai.device;

public enum DeviceType {
    PHONE,
    TABLET,
    OTHER
}
