package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.SafetyAnalysis;

public class CacheEntry {
    private final String fingerprint;
    private final SafetyAnalysis analysis;
    private final long insertedAt;

    public CacheEntry(String fingerprint, SafetyAnalysis analysis, long insertedAt) {
        this.fingerprint = fingerprint;
        this.analysis = analysis;
        this.insertedAt = insertedAt;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public SafetyAnalysis getAnalysis() {
        return analysis;
    }

    public long getInsertedAt() {
        return insertedAt;
    }

    boolean isExpired(long now, long ttlMs) {
        return now - insertedAt >= ttlMs;
    }
}
