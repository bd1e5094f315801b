package com.hazardhawk.server.ai;

/**
 * Kind of construction activity shown in the photo, supplied by the caller.
 */
public enum WorkType {
    GENERAL_CONSTRUCTION,
    ELECTRICAL,
    PLUMBING,
    ROOFING,
    SCAFFOLDING,
    EXCAVATION,
    CONCRETE,
    WELDING,
    PAINTING,
    DEMOLITION,
    FALL_PROTECTION,
    CRANE_OPERATIONS,
    STEEL_ERECTION,
    MAINTENANCE,
    LANDSCAPING
}
