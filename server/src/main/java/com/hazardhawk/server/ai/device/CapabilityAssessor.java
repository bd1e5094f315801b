package com.hazardhawk.server.ai.device;

import com.hazardhawk.server.ai.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Classifies the host into a {@link PerformanceTier}. The first successful assessment is kept for
 * the lifetime of this instance; thermal state and memory pressure are read live on every call.
 */
public class CapabilityAssessor {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityAssessor.class);

    public static final int HIGH_TIER_SCORE = 8;
    public static final int MEDIUM_TIER_SCORE = 5;
    public static final int TABLET_MIN_DP = 600;

    private final PlatformProbe probe;
    private final OrchestratorConfig.Device config;
    private final Object lock = new Object();
    private volatile DeviceCapability cached;

    public CapabilityAssessor(PlatformProbe probe, OrchestratorConfig.Device config) {
        this.probe = probe;
        this.config = config != null ? config : new OrchestratorConfig.Device();
    }

    public DeviceCapability assess() {
        DeviceCapability current = cached;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (cached != null) {
                return cached;
            }
            try {
                long memoryMb = probe.availableMemoryMb();
                int cores = probe.cpuCoreCount();
                boolean gpu = probe.hasGpu();
                boolean npu = probe.hasNpu();
                int platformVersion = probe.platformVersion();
                DeviceType deviceType = classifyDeviceType(probe.smallestScreenWidthDp(), probe.productIdentifier());

                int score = score(memoryMb, cores, gpu, platformPoints(platformVersion));
                PerformanceTier tier = tierForScore(score);

                DeviceCapability capability = new DeviceCapability(deviceType, memoryMb, cores, gpu, npu,
                        platformVersion, score, tier);
                logger.info("Device capability assessed: {}", capability);
                cached = capability;
                return capability;
            } catch (RuntimeException e) {
                logger.warn("Device probe failed, using conservative defaults: {}", e.toString());
                return DeviceCapability.conservativeDefault();
            }
        }
    }

    public ThermalState currentThermalState() {
        try {
            ThermalState fromTemperature = thermalFromTemperature(probe.temperatureCelsius());
            ThermalState fromFrequency = thermalFromFrequency(probe.currentCpuFrequencyKhz(),
                    probe.maxCpuFrequencyKhz());
            return ThermalState.hottest(fromTemperature, fromFrequency);
        } catch (RuntimeException e) {
            logger.debug("Thermal probe failed: {}", e.toString());
            return ThermalState.NOMINAL;
        }
    }

    public MemoryPressure currentMemoryPressure() {
        try {
            return memoryPressureForRatio(probe.memoryUsageRatio());
        } catch (RuntimeException e) {
            logger.debug("Memory probe failed: {}", e.toString());
            return MemoryPressure.MEDIUM;
        }
    }

    /**
     * Deterministic 0-10 score: memory 0-3, cores 0-3, GPU 0-2, platform 0-2.
     */
    public static int score(long memoryMb, int cpuCores, boolean hasGpu, int platformPoints) {
        int score = 0;

        if (memoryMb >= 6144) {
            score += 3;
        } else if (memoryMb >= 4096) {
            score += 2;
        } else if (memoryMb >= 3072) {
            score += 1;
        }

        if (cpuCores >= 8) {
            score += 3;
        } else if (cpuCores >= 6) {
            score += 2;
        } else if (cpuCores >= 4) {
            score += 1;
        }

        if (hasGpu) {
            score += 2;
        }

        score += Math.max(0, Math.min(2, platformPoints));
        return score;
    }

    public static PerformanceTier tierForScore(int score) {
        if (score >= HIGH_TIER_SCORE) {
            return PerformanceTier.HIGH;
        }
        if (score >= MEDIUM_TIER_SCORE) {
            return PerformanceTier.MEDIUM;
        }
        return PerformanceTier.LOW;
    }

    /** 2 for the newest platform line, 1 for recent, 0 for older. */
    public int platformPoints(int platformVersion) {
        if (platformVersion >= config.newestPlatformVersion) {
            return 2;
        }
        if (platformVersion >= config.recentPlatformVersion) {
            return 1;
        }
        return 0;
    }

    public static DeviceType classifyDeviceType(int smallestScreenWidthDp, String productIdentifier) {
        if (smallestScreenWidthDp >= TABLET_MIN_DP) {
            return DeviceType.TABLET;
        }
        if (productIdentifier != null && productIdentifier.toUpperCase(Locale.ROOT).contains("TV")) {
            return DeviceType.OTHER;
        }
        if (smallestScreenWidthDp < 0) {
            return DeviceType.OTHER;
        }
        return DeviceType.PHONE;
    }

    static ThermalState thermalFromTemperature(double celsius) {
        if (Double.isNaN(celsius)) {
            return ThermalState.NOMINAL;
        }
        if (celsius >= 85) {
            return ThermalState.CRITICAL_THROTTLING;
        }
        if (celsius >= 70) {
            return ThermalState.SEVERE_THROTTLING;
        }
        if (celsius >= 60) {
            return ThermalState.MODERATE_THROTTLING;
        }
        if (celsius >= 50) {
            return ThermalState.LIGHT_THROTTLING;
        }
        return ThermalState.NOMINAL;
    }

    static ThermalState thermalFromFrequency(long currentKhz, long maxKhz) {
        if (currentKhz <= 0 || maxKhz <= 0) {
            return ThermalState.NOMINAL;
        }
        double ratio = (double) currentKhz / (double) maxKhz;
        if (ratio > 0.95) {
            return ThermalState.NOMINAL;
        }
        if (ratio > 0.80) {
            return ThermalState.LIGHT_THROTTLING;
        }
        if (ratio > 0.60) {
            return ThermalState.MODERATE_THROTTLING;
        }
        if (ratio > 0.40) {
            return ThermalState.SEVERE_THROTTLING;
        }
        return ThermalState.CRITICAL_THROTTLING;
    }

    static MemoryPressure memoryPressureForRatio(double usedRatio) {
        if (usedRatio > 0.9) {
            return MemoryPressure.CRITICAL;
        }
        if (usedRatio > 0.7) {
            return MemoryPressure.HIGH;
        }
        if (usedRatio > 0.5) {
            return MemoryPressure.MEDIUM;
        }
        return MemoryPressure.LOW;
    }
}
