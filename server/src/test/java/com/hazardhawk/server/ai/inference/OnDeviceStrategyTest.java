package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.DetectionParameters;
import com.hazardhawk.server.ai.OrchestratorConfig;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.device.CapabilityAssessor;
import com.hazardhawk.server.ai.device.FakePlatformProbe;
import com.hazardhawk.server.ai.device.PerformanceTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.hazardhawk.server.ai.SafetyAnalysis;

import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class OnDeviceStrategyTest {

    private static final byte[] IMAGE = {1, 2, 3, 4};

    private OrchestratorConfig.Device config;
    private FakePlatformProbe probe;
    private FakeModelEngine engine;
    private OnDeviceStrategy strategy;

    @BeforeEach
    public void setUp() {
        config = new OrchestratorConfig.Device();
        probe = FakePlatformProbe.highEnd();
        probe.npu = true;
        engine = new FakeModelEngine(Backend.CPU, Backend.GPU, Backend.NPU);
        CapabilityAssessor assessor = new CapabilityAssessor(probe, config);
        strategy = new OnDeviceStrategy("accelerated", 300, PerformanceTier.MEDIUM, engine,
                new BackendSelector(engine.supportedBackends(), config), assessor, true);
    }

    @Test
    public void testInitializesOnPreferredBackend() throws Exception {
        assertNotNull(strategy.analyze(IMAGE, WorkType.ELECTRICAL));
        strategy.analyze(IMAGE, WorkType.ELECTRICAL);

        assertEquals(Arrays.asList(Backend.GPU), engine.initializeCalls);
        assertEquals(Backend.GPU, strategy.getActiveBackend());
        assertEquals(2, engine.runCalls);
    }

    @Test
    public void testOutOfMemoryRetriesOnceOnLowerBackend() throws Exception {
        engine.oomBackends.add(Backend.GPU);

        strategy.analyze(IMAGE, WorkType.ELECTRICAL);
        strategy.analyze(IMAGE, WorkType.ELECTRICAL);

        assertEquals(Arrays.asList(Backend.GPU, Backend.NPU), engine.initializeCalls);
        assertEquals(Backend.NPU, strategy.getActiveBackend());
        assertTrue(strategy.isAvailable());
    }

    @Test
    public void testRawOutOfMemoryErrorIsHandledTheSameWay() throws Exception {
        engine.oomErrorBackends.add(Backend.GPU);

        assertNotNull(strategy.analyze(IMAGE, WorkType.ELECTRICAL));

        assertEquals(Arrays.asList(Backend.GPU, Backend.NPU), engine.initializeCalls);
        assertEquals(Backend.NPU, strategy.getActiveBackend());
        assertTrue(strategy.isAvailable());
    }

    @Test
    public void testFailsPermanentlyWhenRetryAlsoFails() {
        engine.oomBackends.add(Backend.GPU);
        engine.oomBackends.add(Backend.NPU);

        AnalysisException e = assertThrows(AnalysisException.class,
                () -> strategy.analyze(IMAGE, WorkType.ELECTRICAL));
        assertEquals(AnalysisErrorKind.CONFIGURATION, e.getKind());
        assertFalse(strategy.isAvailable());

        // never retried again
        assertThrows(AnalysisException.class, () -> strategy.analyze(IMAGE, WorkType.ELECTRICAL));
        assertEquals(Arrays.asList(Backend.GPU, Backend.NPU), engine.initializeCalls);
    }

    @Test
    public void testNonMemoryInitFailureIsNotPermanent() throws Exception {
        engine.initFailure = AnalysisException.inference("model file corrupt");

        AnalysisException e = assertThrows(AnalysisException.class,
                () -> strategy.analyze(IMAGE, WorkType.ELECTRICAL));
        assertEquals(AnalysisErrorKind.CONFIGURATION, e.getKind());
        assertTrue(strategy.isAvailable());

        engine.initFailure = null;
        assertNotNull(strategy.analyze(IMAGE, WorkType.ELECTRICAL));
    }

    @Test
    public void testSevereHeatSwitchesToCpuAndReportsThrottling() throws Exception {
        strategy.analyze(IMAGE, WorkType.ELECTRICAL);
        assertFalse(strategy.isThermallyThrottled());

        probe.temperature = 75;
        assertTrue(strategy.isThermallyThrottled());
        strategy.analyze(IMAGE, WorkType.ELECTRICAL);

        assertEquals(Backend.CPU, strategy.getActiveBackend());
        assertEquals(1, engine.releaseCalls);
    }

    @Test
    public void testRefusesAtCriticalHeat() {
        probe.temperature = 90;

        AnalysisException e = assertThrows(AnalysisException.class,
                () -> strategy.analyze(IMAGE, WorkType.ELECTRICAL));
        assertEquals(AnalysisErrorKind.THERMAL_THROTTLING, e.getKind());
        assertTrue(engine.initializeCalls.isEmpty());
    }

    @Test
    public void testDetectionParametersReachEngine() throws Exception {
        DetectionParameters parameters = new DetectionParameters(0.6f, 0.3f);
        strategy.updateDetectionParameters(parameters);

        strategy.analyze(IMAGE, WorkType.ELECTRICAL);

        assertSame(parameters, engine.lastParameters);
    }

    @Test
    public void testConfigureLoadsEngineEagerly() throws Exception {
        strategy.configure(null);
        assertEquals(Arrays.asList(Backend.GPU), engine.initializeCalls);
    }

    @Test
    public void testInterruptWhileWaitingForBackendSwitchAbandonsSwitch() throws Exception {
        strategy.analyze(IMAGE, WorkType.ELECTRICAL);
        CountDownLatch gate = new CountDownLatch(1);
        engine.runGate = gate;

        AtomicReference<SafetyAnalysis> running = new AtomicReference<>();
        Thread inference = new Thread(() -> {
            try {
                running.set(strategy.analyze(IMAGE, WorkType.ELECTRICAL));
            } catch (Exception e) {
                fail(e);
            }
        });
        inference.start();
        assertTrue(engine.runStarted.await(2, TimeUnit.SECONDS));

        // heat forces a switch to CPU, which has to wait for the running inference
        probe.temperature = 75;
        AtomicReference<Throwable> switchError = new AtomicReference<>();
        Thread switching = new Thread(() -> {
            try {
                strategy.analyze(IMAGE, WorkType.ELECTRICAL);
            } catch (Throwable t) {
                switchError.set(t);
            }
        });
        switching.start();
        Thread.sleep(200);
        switching.interrupt();
        switching.join(1000);

        assertFalse(switching.isAlive());
        assertTrue(switchError.get() instanceof InterruptedException, "got " + switchError.get());

        gate.countDown();
        inference.join(2000);
        assertNotNull(running.get());
        assertEquals(Arrays.asList(Backend.GPU), engine.initializeCalls);
        assertEquals(0, engine.releaseCalls);
        assertEquals(Backend.GPU, strategy.getActiveBackend());
    }
}
