package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.OrchestratorConfig;
import com.hazardhawk.server.ai.device.CapabilityAssessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class AnalyzerStrategyFactory {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerStrategyFactory.class);

    /**
     * Builds the strategy chain, highest priority first. Missing components and disabled entries
     * are left out of the chain with a warning.
     */
    public static List<AnalyzerStrategy> create(OrchestratorConfig config, CapabilityAssessor assessor,
            ModelEngine acceleratedEngine, CloudAnalysisClient cloudClient, ConnectivityMonitor connectivity,
            ModelEngine fallbackEngine) {
        OrchestratorConfig cfg = config != null ? config : new OrchestratorConfig();
        OrchestratorConfig.Strategies settings = cfg.strategies != null ? cfg.strategies
                : new OrchestratorConfig.Strategies();
        OrchestratorConfig.Device device = cfg.device != null ? cfg.device : new OrchestratorConfig.Device();

        List<AnalyzerStrategy> strategies = new ArrayList<>();

        OrchestratorConfig.StrategySettings accelerated = orDefault(settings.accelerated,
                new OrchestratorConfig.Strategies().accelerated);
        if (!accelerated.enabled) {
            logger.info("On-device accelerated strategy disabled by configuration");
        } else if (acceleratedEngine == null) {
            logger.warn("No accelerated model engine provided, skipping '{}'", accelerated.name);
        } else {
            BackendSelector selector = new BackendSelector(acceleratedEngine.supportedBackends(), device);
            strategies.add(new OnDeviceStrategy(accelerated.name, accelerated.priority, accelerated.minimumTier,
                    acceleratedEngine, selector, assessor, device.refuseOnCriticalThermal));
        }

        OrchestratorConfig.StrategySettings cloud = orDefault(settings.cloud,
                new OrchestratorConfig.Strategies().cloud);
        if (!cloud.enabled) {
            logger.info("Cloud strategy disabled by configuration");
        } else if (cloudClient == null || connectivity == null) {
            logger.warn("Cloud client or connectivity monitor missing, skipping '{}'", cloud.name);
        } else {
            strategies.add(new CloudStrategy(cloud.name, cloud.priority, cloud.minimumTier, cloudClient,
                    connectivity));
        }

        OrchestratorConfig.StrategySettings fallback = orDefault(settings.fallback,
                new OrchestratorConfig.Strategies().fallback);
        if (!fallback.enabled) {
            logger.info("Fallback strategy disabled by configuration");
        } else if (fallbackEngine == null) {
            logger.warn("No fallback model engine provided, skipping '{}'", fallback.name);
        } else {
            strategies.add(new FallbackStrategy(fallback.name, fallback.priority, fallback.minimumTier,
                    fallbackEngine));
        }

        strategies.sort(Comparator.comparingInt(AnalyzerStrategy::getPriority).reversed());
        if (strategies.isEmpty()) {
            logger.warn("Strategy chain is empty; every analysis will be exhausted");
        }
        return strategies;
    }

    private static OrchestratorConfig.StrategySettings orDefault(OrchestratorConfig.StrategySettings value,
            OrchestratorConfig.StrategySettings fallback) {
        if (value == null) {
            return fallback;
        }
        if (value.name == null || value.name.trim().isEmpty()) {
            value.name = fallback.name;
        }
        return value;
    }
}
