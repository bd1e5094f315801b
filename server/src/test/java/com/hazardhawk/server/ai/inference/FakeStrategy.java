package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.AnalysisCapability;
import com.hazardhawk.server.ai.AnalysisType;
import com.hazardhawk.server.ai.DetectionParameters;
import com.hazardhawk.server.ai.RiskLevel;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.device.PerformanceTier;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable strategy for coordinator tests.
 */
public class FakeStrategy implements AnalyzerStrategy {
    private final String name;
    private final int priority;
    private final AnalysisType type;

    public volatile boolean available = true;
    public volatile boolean degraded = false;
    public volatile boolean throttled = false;
    public volatile PerformanceTier minimumTier = PerformanceTier.LOW;
    public volatile float confidence = 0.9f;
    public volatile long delayMs = 0;
    public volatile AnalysisException failure;
    public volatile AnalysisException configureFailure;
    public volatile CountDownLatch started = new CountDownLatch(1);
    public volatile boolean interrupted = false;
    public volatile DetectionParameters parameters;

    public final AtomicInteger analyzeCalls = new AtomicInteger();
    public final AtomicInteger availabilityChecks = new AtomicInteger();
    public final AtomicInteger configureCalls = new AtomicInteger();

    public FakeStrategy(String name, int priority, AnalysisType type) {
        this.name = name;
        this.priority = priority;
        this.type = type;
    }

    public FakeStrategy failingWith(AnalysisException failure) {
        this.failure = failure;
        return this;
    }

    public FakeStrategy slow(long delayMs) {
        this.delayMs = delayMs;
        return this;
    }

    public FakeStrategy unavailable() {
        this.available = false;
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public Set<AnalysisCapability> getCapabilities() {
        return Collections.unmodifiableSet(EnumSet.of(AnalysisCapability.HAZARD_IDENTIFICATION));
    }

    @Override
    public AnalysisType getAnalysisType() {
        return type;
    }

    @Override
    public boolean isAvailable() {
        availabilityChecks.incrementAndGet();
        return available;
    }

    @Override
    public boolean isDegraded() {
        return degraded;
    }

    @Override
    public PerformanceTier getMinimumTier() {
        return minimumTier;
    }

    @Override
    public boolean isThermallyThrottled() {
        return throttled;
    }

    @Override
    public void updateDetectionParameters(DetectionParameters parameters) {
        this.parameters = parameters;
    }

    @Override
    public SafetyAnalysis analyze(byte[] image, WorkType workType) throws AnalysisException, InterruptedException {
        analyzeCalls.incrementAndGet();
        started.countDown();
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                interrupted = true;
                throw e;
            }
        }
        if (failure != null) {
            throw failure;
        }
        return SafetyAnalysis.builder(workType)
                .analysisType(AnalysisType.LOCAL_ACCELERATED)
                .overallRiskLevel(RiskLevel.MODERATE)
                .recommendation("Wear a hard hat")
                .confidence(confidence)
                .build();
    }

    @Override
    public void configure(String credential) throws AnalysisException {
        configureCalls.incrementAndGet();
        if (configureFailure != null) {
            throw configureFailure;
        }
    }
}
