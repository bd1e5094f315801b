package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.AnalysisCapability;
import com.hazardhawk.server.ai.AnalysisType;
import com.hazardhawk.server.ai.DetectionParameters;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.device.CapabilityAssessor;
import com.hazardhawk.server.ai.device.DeviceCapability;
import com.hazardhawk.server.ai.device.MemoryPressure;
import com.hazardhawk.server.ai.device.PerformanceTier;
import com.hazardhawk.server.ai.device.ThermalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Hardware-accelerated on-device analysis. Resolves a backend through {@link BackendSelector}
 * before each call and re-initializes the engine when the selection changes.
 *
 * <p>An out-of-memory failure while loading onto a backend is retried once on the next lower
 * backend; the failed backend is never tried again by this instance. If the retry fails too, the
 * strategy stays unavailable for good.
 */
public class OnDeviceStrategy implements AnalyzerStrategy {

    private static final Logger logger = LoggerFactory.getLogger(OnDeviceStrategy.class);

    private static final Set<AnalysisCapability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(
            AnalysisCapability.MULTIMODAL_VISION,
            AnalysisCapability.PPE_DETECTION,
            AnalysisCapability.HAZARD_IDENTIFICATION,
            AnalysisCapability.OSHA_COMPLIANCE,
            AnalysisCapability.OFFLINE_ANALYSIS,
            AnalysisCapability.HARDWARE_ACCELERATION));

    private final String name;
    private final int priority;
    private final PerformanceTier minimumTier;
    private final ModelEngine engine;
    private final BackendSelector selector;
    private final CapabilityAssessor assessor;
    private final boolean refuseOnCriticalThermal;

    private final ReentrantReadWriteLock engineLock = new ReentrantReadWriteLock();
    private final Set<Backend> exhaustedBackends = ConcurrentHashMap.newKeySet();
    private volatile Backend activeBackend;
    private volatile boolean permanentlyFailed;
    private volatile String failureReason;
    private volatile DetectionParameters parameters = DetectionParameters.defaults();

    public OnDeviceStrategy(String name, int priority, PerformanceTier minimumTier, ModelEngine engine,
            BackendSelector selector, CapabilityAssessor assessor, boolean refuseOnCriticalThermal) {
        this.name = name;
        this.priority = priority;
        this.minimumTier = minimumTier != null ? minimumTier : PerformanceTier.LOW;
        this.engine = engine;
        this.selector = selector;
        this.assessor = assessor;
        this.refuseOnCriticalThermal = refuseOnCriticalThermal;
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
        return AnalysisType.LOCAL_ACCELERATED;
    }

    @Override
    public PerformanceTier getMinimumTier() {
        return minimumTier;
    }

    @Override
    public boolean isAvailable() {
        return !permanentlyFailed;
    }

    @Override
    public boolean isThermallyThrottled() {
        return currentSelection(assessor.currentThermalState()).isThermallyForced();
    }

    @Override
    public void updateDetectionParameters(DetectionParameters parameters) {
        this.parameters = parameters;
    }

    public Backend getActiveBackend() {
        return activeBackend;
    }

    @Override
    public void configure(String credential) throws AnalysisException {
        try {
            ensureBackend(currentSelection(assessor.currentThermalState()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AnalysisException.configuration(name + " configuration interrupted", e);
        }
    }

    @Override
    public SafetyAnalysis analyze(byte[] image, WorkType workType) throws AnalysisException, InterruptedException {
        if (permanentlyFailed) {
            throw AnalysisException.configuration(failureReason);
        }
        ThermalState thermal = assessor.currentThermalState();
        if (refuseOnCriticalThermal && thermal.isAtLeast(ThermalState.CRITICAL_THROTTLING)) {
            throw AnalysisException.thermalThrottling(name + " refused: thermal state " + thermal);
        }
        ensureBackend(currentSelection(thermal));

        engineLock.readLock().lockInterruptibly();
        try {
            return engine.run(image, workType, parameters);
        } catch (OutOfMemoryError e) {
            throw AnalysisException.outOfMemory(name + " ran out of memory during inference on " + activeBackend, e);
        } finally {
            engineLock.readLock().unlock();
        }
    }

    private BackendSelection currentSelection(ThermalState thermal) {
        return selector.selectBackend(assessor.assess(), thermal, assessor.currentMemoryPressure());
    }

    private void ensureBackend(BackendSelection selection) throws AnalysisException, InterruptedException {
        if (!permanentlyFailed && activeBackend != null && activeBackend == resolveTarget(selection.getBackend())) {
            return;
        }
        // a switch waits for running inferences to drain; a cancelled attempt must not go on to do it
        engineLock.writeLock().lockInterruptibly();
        try {
            if (Thread.interrupted()) {
                throw new InterruptedException(name + " interrupted before backend switch");
            }
            if (permanentlyFailed) {
                throw AnalysisException.configuration(failureReason);
            }
            Backend target = resolveTarget(selection.getBackend());
            if (target == null) {
                markFailed("no usable backend left after out-of-memory failures");
                throw AnalysisException.configuration(failureReason);
            }
            if (target == activeBackend) {
                return;
            }
            if (activeBackend != null) {
                logger.info("{}: switching backend {} -> {} ({})", name, activeBackend, target, selection.getReason());
                engine.release();
                activeBackend = null;
            }
            initializeWithRetry(target);
        } finally {
            engineLock.writeLock().unlock();
        }
    }

    // Walks down past backends that already ran out of memory.
    private Backend resolveTarget(Backend selected) {
        Backend target = selected;
        if (exhaustedBackends.isEmpty()) {
            return target;
        }
        DeviceCapability capability = assessor.assess();
        MemoryPressure pressure = assessor.currentMemoryPressure();
        while (target != null && exhaustedBackends.contains(target)) {
            target = selector.nextLowerBackend(target, capability, pressure).orElse(null);
        }
        return target;
    }

    private void initializeWithRetry(Backend preferred) throws AnalysisException {
        try {
            initializeOn(preferred);
            activeBackend = preferred;
            logger.info("{}: engine initialized on {}", name, preferred);
            return;
        } catch (AnalysisException e) {
            if (e.getKind() != AnalysisErrorKind.OUT_OF_MEMORY) {
                throw AnalysisException.configuration(name + " failed to initialize on " + preferred, e);
            }
            exhaustedBackends.add(preferred);
            Optional<Backend> lower = selector.nextLowerBackend(preferred, assessor.assess(),
                    assessor.currentMemoryPressure());
            if (!lower.isPresent()) {
                markFailed("out of memory on " + preferred + " and no lower backend to retry");
                throw AnalysisException.configuration(failureReason, e);
            }
            logger.warn("{}: out of memory initializing on {}, retrying once on {}", name, preferred, lower.get());
            try {
                initializeOn(lower.get());
                activeBackend = lower.get();
                logger.info("{}: engine initialized on {} after fallback", name, lower.get());
            } catch (AnalysisException retryError) {
                markFailed("initialization failed on " + preferred + " and on retry with " + lower.get());
                throw AnalysisException.configuration(failureReason, retryError);
            }
        }
    }

    private void initializeOn(Backend backend) throws AnalysisException {
        try {
            engine.initialize(backend);
        } catch (OutOfMemoryError e) {
            throw AnalysisException.outOfMemory("out of memory initializing on " + backend, e);
        }
    }

    private void markFailed(String reason) {
        failureReason = name + " permanently unavailable: " + reason;
        permanentlyFailed = true;
        logger.error(failureReason);
    }
}
