package com.hazardhawk.server.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hazardhawk.server.ai.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;

public class ConfigPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigPathResolver.class);

    public static final String CONFIG_PROPERTY = "hazardhawk.config";
    public static final String CONFIG_RESOURCE = "/orchestrator_config.json";

    /**
     * Loads the coordinator settings: the file named by the {@value #CONFIG_PROPERTY} system
     * property if set, else the bundled {@value #CONFIG_RESOURCE}, else built-in defaults.
     */
    public static OrchestratorConfig loadConfig() {
        ObjectMapper mapper = new ObjectMapper();

        // 1. System property
        String path = System.getProperty(CONFIG_PROPERTY);
        if (path != null && !path.isEmpty()) {
            File file = new File(path);
            try {
                OrchestratorConfig config = mapper.readValue(file, OrchestratorConfig.class);
                logger.info("Loaded orchestrator config from {}", file.getAbsolutePath());
                return applyDefaults(config);
            } catch (IOException e) {
                throw new RuntimeException("Failed to load orchestrator config from " + path, e);
            }
        }

        // 2. Classpath resource
        try (InputStream is = ConfigPathResolver.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                OrchestratorConfig config = mapper.readValue(is, OrchestratorConfig.class);
                logger.info("Loaded orchestrator config from classpath {}", CONFIG_RESOURCE);
                return applyDefaults(config);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}, using defaults: {}", CONFIG_RESOURCE, e.getMessage());
        }

        // 3. Defaults
        logger.info("No orchestrator config found, using defaults");
        return new OrchestratorConfig();
    }

    /** Replaces sections set to null in the JSON with their defaults. */
    public static OrchestratorConfig applyDefaults(OrchestratorConfig config) {
        if (config == null) {
            return new OrchestratorConfig();
        }
        if (config.device == null) {
            config.device = new OrchestratorConfig.Device();
        }
        if (config.timeouts == null) {
            config.timeouts = new OrchestratorConfig.Timeouts();
        }
        if (config.cache == null) {
            config.cache = new OrchestratorConfig.Cache();
        }
        if (config.rateLimit == null) {
            config.rateLimit = new OrchestratorConfig.RateLimit();
        }
        if (config.stats == null) {
            config.stats = new OrchestratorConfig.Stats();
        }
        if (config.strategies == null) {
            config.strategies = new OrchestratorConfig.Strategies();
        }
        if (config.detection == null) {
            config.detection = new OrchestratorConfig.Detection();
        }
        if (config.disabledStrategies == null) {
            config.disabledStrategies = new ArrayList<>();
        }
        if (config.device.severeThermalState == null) {
            config.device.severeThermalState = new OrchestratorConfig.Device().severeThermalState;
        }
        return config;
    }
}
