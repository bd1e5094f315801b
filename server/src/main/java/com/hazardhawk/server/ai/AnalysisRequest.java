package com.hazardhawk.server.ai;

import com.hazardhawk.util.ImageFingerprint;

/**
 * One photo to analyze. The image bytes are copied on the way in and on the way out.
 */
public class AnalysisRequest {
    private final byte[] image;
    private final WorkType workType;
    private final long createdAt;
    private final String fingerprint;

    public AnalysisRequest(byte[] image, WorkType workType) {
        this(image, workType, System.currentTimeMillis());
    }

    public AnalysisRequest(byte[] image, WorkType workType, long createdAt) {
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("Image data must not be empty");
        }
        if (workType == null) {
            throw new IllegalArgumentException("Work type must be specified");
        }
        this.image = image.clone();
        this.workType = workType;
        this.createdAt = createdAt;
        this.fingerprint = ImageFingerprint.of(this.image, workType.name());
    }

    public byte[] getImage() {
        return image.clone();
    }

    public int getImageSize() {
        return image.length;
    }

    public WorkType getWorkType() {
        return workType;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    /** Cache key over image content and work type. */
    public String getFingerprint() {
        return fingerprint;
    }
}
