package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.AnalysisCapability;
import com.hazardhawk.server.ai.AnalysisType;
import com.hazardhawk.server.ai.DetectionParameters;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.device.PerformanceTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Basic detector pinned to CPU. Always the last resort, so its results are marked degraded.
 */
public class FallbackStrategy implements AnalyzerStrategy {

    private static final Logger logger = LoggerFactory.getLogger(FallbackStrategy.class);

    private static final Set<AnalysisCapability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(
            AnalysisCapability.PPE_DETECTION,
            AnalysisCapability.HAZARD_IDENTIFICATION,
            AnalysisCapability.OFFLINE_ANALYSIS,
            AnalysisCapability.REAL_TIME_PROCESSING));

    private final String name;
    private final int priority;
    private final PerformanceTier minimumTier;
    private final ModelEngine engine;

    private final Object initLock = new Object();
    private volatile boolean initialized;
    private volatile String failureReason;
    private volatile DetectionParameters parameters = DetectionParameters.defaults();

    public FallbackStrategy(String name, int priority, PerformanceTier minimumTier, ModelEngine engine) {
        this.name = name;
        this.priority = priority;
        this.minimumTier = minimumTier != null ? minimumTier : PerformanceTier.LOW;
        this.engine = engine;
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
        return CAPABILITIES;
    }

    @Override
    public AnalysisType getAnalysisType() {
        return AnalysisType.LOCAL_FALLBACK;
    }

    @Override
    public PerformanceTier getMinimumTier() {
        return minimumTier;
    }

    @Override
    public boolean isDegraded() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        return failureReason == null;
    }

    @Override
    public void updateDetectionParameters(DetectionParameters parameters) {
        this.parameters = parameters;
    }

    @Override
    public void configure(String credential) throws AnalysisException {
        ensureInitialized();
    }

    @Override
    public SafetyAnalysis analyze(byte[] image, WorkType workType) throws AnalysisException, InterruptedException {
        ensureInitialized();
        return engine.run(image, workType, parameters);
    }

    private void ensureInitialized() throws AnalysisException {
        if (initialized) {
            return;
        }
        synchronized (initLock) {
            if (initialized) {
                return;
            }
            if (failureReason != null) {
                throw AnalysisException.configuration(failureReason);
            }
            try {
                engine.initialize(Backend.CPU);
                initialized = true;
                logger.info("{}: engine initialized on CPU", name);
            } catch (OutOfMemoryError e) {
                // nothing below CPU to retry on
                failureReason = name + " permanently unavailable: out of memory on CPU";
                logger.error(failureReason);
                throw AnalysisException.configuration(failureReason, e);
            } catch (AnalysisException e) {
                if (e.getKind() == AnalysisErrorKind.OUT_OF_MEMORY) {
                    failureReason = name + " permanently unavailable: out of memory on CPU";
                    logger.error(failureReason);
                }
                throw AnalysisException.configuration(name + " failed to initialize on CPU", e);
            }
        }
    }
}
