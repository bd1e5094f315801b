package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.OrchestratorConfig;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.device.CapabilityAssessor;
import com.hazardhawk.server.ai.device.FakePlatformProbe;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerStrategyFactoryTest {

    private final CloudAnalysisClient cloudClient = new CloudAnalysisClient() {
        @Override
        public void configure(String credential) {
        }

        @Override
        public boolean isConfigured() {
            return true;
        }

        @Override
        public SafetyAnalysis analyze(byte[] image, WorkType workType) {
            return SafetyAnalysis.builder(workType).build();
        }
    };

    private final CapabilityAssessor assessor = new CapabilityAssessor(new FakePlatformProbe(), null);

    @Test
    public void testFullChainOrderedByPriority() {
        List<AnalyzerStrategy> strategies = AnalyzerStrategyFactory.create(new OrchestratorConfig(), assessor,
                new FakeModelEngine(Backend.GPU, Backend.CPU), cloudClient, () -> true, new FakeModelEngine());

        assertEquals(3, strategies.size());
        assertTrue(strategies.get(0) instanceof OnDeviceStrategy);
        assertTrue(strategies.get(1) instanceof CloudStrategy);
        assertTrue(strategies.get(2) instanceof FallbackStrategy);
        assertEquals("On-device accelerated", strategies.get(0).getName());
    }

    @Test
    public void testMissingComponentsAreSkipped() {
        List<AnalyzerStrategy> strategies = AnalyzerStrategyFactory.create(new OrchestratorConfig(), assessor,
                null, cloudClient, null, new FakeModelEngine());

        assertEquals(1, strategies.size());
        assertTrue(strategies.get(0) instanceof FallbackStrategy);
    }

    @Test
    public void testDisabledAndReprioritized() {
        OrchestratorConfig config = new OrchestratorConfig();
        config.strategies.accelerated.enabled = false;
        config.strategies.fallback.priority = 500;
        config.strategies.cloud.name = null;

        List<AnalyzerStrategy> strategies = AnalyzerStrategyFactory.create(config, assessor,
                new FakeModelEngine(), cloudClient, () -> true, new FakeModelEngine());

        assertEquals(2, strategies.size());
        assertTrue(strategies.get(0) instanceof FallbackStrategy);
        assertEquals("Cloud vision", strategies.get(1).getName());
    }

    @Test
    public void testNullConfigUsesDefaults() {
        List<AnalyzerStrategy> strategies = AnalyzerStrategyFactory.create(null, assessor,
                null, null, null, null);
        assertTrue(strategies.isEmpty());
    }
}
