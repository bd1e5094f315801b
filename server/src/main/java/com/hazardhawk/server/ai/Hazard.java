package com.hazardhawk.server.ai;

public class Hazard {
    private final HazardType type;
    private final Severity severity;
    private final float confidence;
    private final String description;
    private final BoundingBox boundingBox;
    private final String oshaCode;

    public Hazard(HazardType type, Severity severity, float confidence, String description,
            BoundingBox boundingBox, String oshaCode) {
        this.type = type;
        this.severity = severity;
        this.confidence = confidence;
        this.description = description;
        this.boundingBox = boundingBox;
        this.oshaCode = oshaCode;
    }

    public Hazard(HazardType type, Severity severity, float confidence, String description) {
        this(type, severity, confidence, description, null, null);
    }

    public HazardType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public float getConfidence() {
        return confidence;
    }

    public String getDescription() {
        return description;
    }

    /** May be null when the strategy does not localize hazards. */
    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    /** May be null. */
    public String getOshaCode() {
        return oshaCode;
    }

    @Override
    public String toString() {
        return "Hazard{" + type + ", severity=" + severity + ", confidence=" + confidence
                + (oshaCode != null ? ", osha=" + oshaCode : "") + '}';
    }
}
