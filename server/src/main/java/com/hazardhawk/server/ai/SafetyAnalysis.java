package com.hazardhawk.server.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Result of a safety analysis. Instances are immutable; the {@code with*} methods return adjusted
 * copies and leave the receiver untouched, so a cached instance can be handed to many callers.
 */
public class SafetyAnalysis {
    private final String id;
    private final WorkType workType;
    private final AnalysisType analysisType;
    private final List<Hazard> hazards;
    private final PpeStatus ppeStatus;
    private final List<String> recommendations;
    private final RiskLevel overallRiskLevel;
    private final float confidence;
    private final long processingTimeMs;
    private final long timestamp;

    public SafetyAnalysis(String id, WorkType workType, AnalysisType analysisType, List<Hazard> hazards,
            PpeStatus ppeStatus, List<String> recommendations, RiskLevel overallRiskLevel, float confidence,
            long processingTimeMs, long timestamp) {
        this.id = id;
        this.workType = workType;
        this.analysisType = analysisType;
        this.hazards = hazards == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(hazards));
        this.ppeStatus = ppeStatus;
        this.recommendations = recommendations == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(recommendations));
        this.overallRiskLevel = overallRiskLevel;
        this.confidence = confidence;
        this.processingTimeMs = processingTimeMs;
        this.timestamp = timestamp;
    }

    public static Builder builder(WorkType workType) {
        return new Builder(workType);
    }

    public String getId() {
        return id;
    }

    public WorkType getWorkType() {
        return workType;
    }

    public AnalysisType getAnalysisType() {
        return analysisType;
    }

    public List<Hazard> getHazards() {
        return hazards;
    }

    public PpeStatus getPpeStatus() {
        return ppeStatus;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public RiskLevel getOverallRiskLevel() {
        return overallRiskLevel;
    }

    public float getConfidence() {
        return confidence;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public SafetyAnalysis withAnalysisType(AnalysisType type) {
        return new SafetyAnalysis(id, workType, type, hazards, ppeStatus, recommendations, overallRiskLevel,
                confidence, processingTimeMs, timestamp);
    }

    public SafetyAnalysis withConfidence(float newConfidence) {
        return new SafetyAnalysis(id, workType, analysisType, hazards, ppeStatus, recommendations,
                overallRiskLevel, newConfidence, processingTimeMs, timestamp);
    }

    public SafetyAnalysis withProcessingTimeMs(long newProcessingTimeMs) {
        return new SafetyAnalysis(id, workType, analysisType, hazards, ppeStatus, recommendations,
                overallRiskLevel, confidence, newProcessingTimeMs, timestamp);
    }

    public SafetyAnalysis withAdditionalRecommendations(List<String> extra) {
        List<String> merged = new ArrayList<>(recommendations);
        merged.addAll(extra);
        return new SafetyAnalysis(id, workType, analysisType, hazards, ppeStatus, merged, overallRiskLevel,
                confidence, processingTimeMs, timestamp);
    }

    @Override
    public String toString() {
        return "SafetyAnalysis{" +
                "id='" + id + '\'' +
                ", type=" + analysisType +
                ", workType=" + workType +
                ", hazards=" + hazards.size() +
                ", risk=" + overallRiskLevel +
                ", confidence=" + String.format("%.3f", confidence) +
                ", processingTimeMs=" + processingTimeMs +
                '}';
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private final WorkType workType;
        private AnalysisType analysisType = AnalysisType.LOCAL_ACCELERATED;
        private final List<Hazard> hazards = new ArrayList<>();
        private PpeStatus ppeStatus;
        private final List<String> recommendations = new ArrayList<>();
        private RiskLevel overallRiskLevel = RiskLevel.MINIMAL;
        private float confidence;
        private long processingTimeMs;
        private long timestamp = System.currentTimeMillis();

        private Builder(WorkType workType) {
            this.workType = workType;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder analysisType(AnalysisType analysisType) {
            this.analysisType = analysisType;
            return this;
        }

        public Builder hazard(Hazard hazard) {
            this.hazards.add(hazard);
            return this;
        }

        public Builder ppeStatus(PpeStatus ppeStatus) {
            this.ppeStatus = ppeStatus;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendations.add(recommendation);
            return this;
        }

        public Builder overallRiskLevel(RiskLevel overallRiskLevel) {
            this.overallRiskLevel = overallRiskLevel;
            return this;
        }

        public Builder confidence(float confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder processingTimeMs(long processingTimeMs) {
            this.processingTimeMs = processingTimeMs;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public SafetyAnalysis build() {
            return new SafetyAnalysis(id, workType, analysisType, hazards, ppeStatus, recommendations,
                    overallRiskLevel, confidence, processingTimeMs, timestamp);
        }
    }
}
