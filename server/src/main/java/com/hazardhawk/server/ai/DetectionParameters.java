package com.hazardhawk.server.ai;

/**
 * Detection thresholds pushed down to strategies that run their own detector.
 */
public class DetectionParameters {
    public static final float DEFAULT_CONFIDENCE_THRESHOLD = 0.5f;
    public static final float DEFAULT_IOU_THRESHOLD = 0.45f;

    private final float confidenceThreshold;
    private final float iouThreshold;

    public DetectionParameters(float confidenceThreshold, float iouThreshold) {
        if (!(confidenceThreshold >= 0f && confidenceThreshold <= 1f)) {
            throw new IllegalArgumentException("confidenceThreshold must be in [0, 1], got " + confidenceThreshold);
        }
        if (!(iouThreshold >= 0f && iouThreshold <= 1f)) {
            throw new IllegalArgumentException("iouThreshold must be in [0, 1], got " + iouThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
        this.iouThreshold = iouThreshold;
    }

    public static DetectionParameters defaults() {
        return new DetectionParameters(DEFAULT_CONFIDENCE_THRESHOLD, DEFAULT_IOU_THRESHOLD);
    }

    public float getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public float getIouThreshold() {
        return iouThreshold;
    }

    @Override
    public String toString() {
        return "DetectionParameters{confidence=" + confidenceThreshold + ", iou=" + iouThreshold + '}';
    }
}
