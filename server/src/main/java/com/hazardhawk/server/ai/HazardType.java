package com.hazardhawk.server.ai;

public enum HazardType {
    FALL_PROTECTION,
    PPE_VIOLATION,
    ELECTRICAL,
    MECHANICAL,
    CHEMICAL,
    FIRE,
    CRANE_LIFT,
    HOUSEKEEPING,
    STRUCK_BY_OBJECT,
    CAUGHT_IN_EQUIPMENT,
    ERGONOMIC,
    ENVIRONMENTAL,
    LOCKOUT_TAGOUT,
    CONFINED_SPACE,
    SCAFFOLDING_UNSAFE,
    EQUIPMENT_DEFECT,
    OTHER
}
