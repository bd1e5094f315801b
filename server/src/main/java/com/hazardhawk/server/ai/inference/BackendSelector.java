package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.OrchestratorConfig;
import com.hazardhawk.server.ai.device.DeviceCapability;
import com.hazardhawk.server.ai.device.MemoryPressure;
import com.hazardhawk.server.ai.device.ThermalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the execution backend for an on-device model engine: GPU, then NPU, then CPU.
 */
public class BackendSelector {

    private static final Logger logger = LoggerFactory.getLogger(BackendSelector.class);

    private final Set<Backend> supportedBackends;
    private final long gpuMinMemoryMb;
    private final ThermalState severeThermalState;

    public BackendSelector(Set<Backend> supportedBackends, OrchestratorConfig.Device config) {
        OrchestratorConfig.Device cfg = config != null ? config : new OrchestratorConfig.Device();
        EnumSet<Backend> copy = EnumSet.noneOf(Backend.class);
        if (supportedBackends != null) {
            copy.addAll(supportedBackends);
        }
        this.supportedBackends = Collections.unmodifiableSet(copy);
        this.gpuMinMemoryMb = cfg.gpuMinMemoryMb;
        this.severeThermalState = cfg.severeThermalState;
    }

    public Set<Backend> getSupportedBackends() {
        return supportedBackends;
    }

    public BackendSelection selectBackend(DeviceCapability capability, ThermalState thermalState,
            MemoryPressure memoryPressure) {
        if (thermalState != null && thermalState.isAtLeast(severeThermalState)) {
            logger.debug("Thermal state {} at or above {}, forcing CPU backend", thermalState, severeThermalState);
            return new BackendSelection(Backend.CPU, true, "thermal state " + thermalState);
        }

        if (supportedBackends.size() == 1 && supportedBackends.contains(Backend.AUTO)) {
            return new BackendSelection(Backend.AUTO, false, "engine delegates backend choice");
        }

        for (Backend candidate : Backend.PREFERENCE_ORDER) {
            if (isEligible(candidate, capability, memoryPressure)) {
                return new BackendSelection(candidate, false, describe(candidate, capability));
            }
        }
        // CPU is always eligible, so this is unreachable
        return new BackendSelection(Backend.CPU, false, "no accelerator eligible");
    }

    /**
     * Next eligible backend below {@code current} in preference order, used once after an
     * out-of-memory failure during setup.
     */
    public Optional<Backend> nextLowerBackend(Backend current, DeviceCapability capability,
            MemoryPressure memoryPressure) {
        if (current == Backend.AUTO) {
            return Optional.of(Backend.CPU);
        }
        int index = Backend.PREFERENCE_ORDER.indexOf(current);
        for (int i = index + 1; i < Backend.PREFERENCE_ORDER.size(); i++) {
            Backend candidate = Backend.PREFERENCE_ORDER.get(i);
            if (isEligible(candidate, capability, memoryPressure)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public boolean isEligible(Backend backend, DeviceCapability capability, MemoryPressure memoryPressure) {
        switch (backend) {
            case GPU:
                // accelerated paths reserve extra working memory
                return supportedBackends.contains(Backend.GPU)
                        && capability.isHasGpu()
                        && capability.getAvailableMemoryMb() >= gpuMinMemoryMb
                        && (memoryPressure == null || !memoryPressure.isAtLeast(MemoryPressure.HIGH));
            case NPU:
                return supportedBackends.contains(Backend.NPU) && capability.isHasNpu();
            case CPU:
                return true;
            case AUTO:
                return supportedBackends.contains(Backend.AUTO);
            default:
                return false;
        }
    }

    private static String describe(Backend backend, DeviceCapability capability) {
        switch (backend) {
            case GPU:
                return "GPU present with " + capability.getAvailableMemoryMb() + "MB available";
            case NPU:
                return "NPU present";
            default:
                return "CPU baseline";
        }
    }
}
