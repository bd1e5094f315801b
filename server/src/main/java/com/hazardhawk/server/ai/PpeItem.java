package com.hazardhawk.server.ai;

public enum PpeItem {
    HARD_HAT,
    SAFETY_VEST,
    SAFETY_BOOTS,
    SAFETY_GLASSES,
    FALL_PROTECTION,
    RESPIRATOR,
    HEARING_PROTECTION,
    HAND_PROTECTION
}
