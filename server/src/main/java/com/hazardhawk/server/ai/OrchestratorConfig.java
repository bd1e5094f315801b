package com.hazardhawk.server.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.hazardhawk.server.ai.device.PerformanceTier;
import com.hazardhawk.server.ai.device.ThermalState;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for one coordinator instance. Bound from {@code orchestrator_config.json}; any key
 * missing from the file keeps the default assigned here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrchestratorConfig {
    public Device device = new Device();
    public Timeouts timeouts = new Timeouts();
    public Cache cache = new Cache();
    public RateLimit rateLimit = new RateLimit();
    public Stats stats = new Stats();
    public Strategies strategies = new Strategies();
    public Detection detection = new Detection();

    public double degradedConfidenceFactor = 0.7;
    public boolean coalesceInFlight = true;
    public int batchConcurrency = 3;

    // Emergency rollback switch, applied at startup; monitoring can flip it at runtime on the coordinator.
    public List<AnalysisType> disabledStrategies = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Device {
        public int newestPlatformVersion = 21;
        public int recentPlatformVersion = 17;
        public long gpuMinMemoryMb = 2048;
        public ThermalState severeThermalState = ThermalState.SEVERE_THROTTLING;
        public boolean refuseOnCriticalThermal = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Timeouts {
        public long highTierMs = 8000;
        public long mediumTierMs = 10000;
        public long lowTierMs = 15000;
        public long cloudMs = 15000;
        public long fallbackMs = 8000;
        public double thermalTimeoutFactor = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Cache {
        public boolean enabled = true;
        public long ttlMs = 120_000;
        public int maxEntries = 50;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RateLimit {
        public double targetFps = 2.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Stats {
        public int rollingWindow = 50;
        public double successFloor = 0.90;
        public int minSamplesForFloor = 10;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Detection {
        public float confidenceThreshold = DetectionParameters.DEFAULT_CONFIDENCE_THRESHOLD;
        public float iouThreshold = DetectionParameters.DEFAULT_IOU_THRESHOLD;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Strategies {
        public StrategySettings accelerated = new StrategySettings("On-device accelerated", 300,
                PerformanceTier.MEDIUM);
        public StrategySettings cloud = new StrategySettings("Cloud vision", 200, PerformanceTier.LOW);
        public StrategySettings fallback = new StrategySettings("Local fallback", 100, PerformanceTier.LOW);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StrategySettings {
        public boolean enabled = true;
        public String name;
        public int priority;
        public PerformanceTier minimumTier = PerformanceTier.LOW;

        public StrategySettings() {
        }

        public StrategySettings(String name, int priority, PerformanceTier minimumTier) {
            this.name = name;
            this.priority = priority;
            this.minimumTier = minimumTier;
        }
    }
}
