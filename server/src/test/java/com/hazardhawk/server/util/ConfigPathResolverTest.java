package com.hazardhawk.server.util;

import com.hazardhawk.server.ai.AnalysisType;
import com.hazardhawk.server.ai.OrchestratorConfig;
import com.hazardhawk.server.ai.device.PerformanceTier;
import com.hazardhawk.server.ai.device.ThermalState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigPathResolverTest {

    @TempDir
    Path tempDir;

    @AfterEach
    public void tearDown() {
        System.clearProperty(ConfigPathResolver.CONFIG_PROPERTY);
    }

    @Test
    public void testLoadsBundledConfig() {
        OrchestratorConfig config = ConfigPathResolver.loadConfig();

        // values in orchestrator_config.json
        assertEquals(8000, config.timeouts.highTierMs);
        assertEquals(15000, config.timeouts.cloudMs);
        assertEquals(0.5, config.timeouts.thermalTimeoutFactor, 1e-9);
        assertEquals(2.0, config.rateLimit.targetFps, 1e-9);
        assertEquals(50, config.stats.rollingWindow);
        assertEquals(0.90, config.stats.successFloor, 1e-9);
        assertEquals(PerformanceTier.MEDIUM, config.strategies.accelerated.minimumTier);
        assertEquals(300, config.strategies.accelerated.priority);
        assertEquals(0.7, config.degradedConfidenceFactor, 1e-9);
        assertTrue(config.coalesceInFlight);
        assertTrue(config.disabledStrategies.isEmpty());
    }

    @Test
    public void testSystemPropertyOverridesAndMissingKeysKeepDefaults() throws Exception {
        File file = tempDir.resolve("override.json").toFile();
        String json = "{\"timeouts\": {\"cloudMs\": 20000}, \"cache\": null, \"unknownKey\": 1,"
                + " \"disabledStrategies\": [\"CLOUD\"], \"device\": {\"severeThermalState\": \"CRITICAL_THROTTLING\"}}";
        Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
        System.setProperty(ConfigPathResolver.CONFIG_PROPERTY, file.getAbsolutePath());

        OrchestratorConfig config = ConfigPathResolver.loadConfig();

        assertEquals(20000, config.timeouts.cloudMs);
        assertEquals(8000, config.timeouts.highTierMs);
        assertNotNull(config.cache);
        assertEquals(50, config.cache.maxEntries);
        assertEquals(ThermalState.CRITICAL_THROTTLING, config.device.severeThermalState);
        assertEquals(2048, config.device.gpuMinMemoryMb);
        assertTrue(config.disabledStrategies.contains(AnalysisType.CLOUD));
    }

    @Test
    public void testBrokenExternalFileFails() throws Exception {
        File file = tempDir.resolve("broken.json").toFile();
        Files.write(file.toPath(), "{not json".getBytes(StandardCharsets.UTF_8));
        System.setProperty(ConfigPathResolver.CONFIG_PROPERTY, file.getAbsolutePath());

        assertThrows(RuntimeException.class, ConfigPathResolver::loadConfig);
    }

    @Test
    public void testApplyDefaultsFillsNullSections() {
        OrchestratorConfig config = new OrchestratorConfig();
        config.timeouts = null;
        config.strategies = null;
        config.disabledStrategies = null;

        OrchestratorConfig fixed = ConfigPathResolver.applyDefaults(config);

        assertEquals(10000, fixed.timeouts.mediumTierMs);
        assertEquals("Local fallback", fixed.strategies.fallback.name);
        assertNotNull(fixed.disabledStrategies);
        assertNotNull(ConfigPathResolver.applyDefaults(null));
    }
}
