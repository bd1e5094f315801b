package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.DetectionParameters;
import com.hazardhawk.server.ai.RiskLevel;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

public class FakeModelEngine implements ModelEngine {
    private final Set<Backend> supported;

    /** Backends whose initialization reports out-of-memory. */
    public final Set<Backend> oomBackends = EnumSet.noneOf(Backend.class);
    /** Backends whose initialization throws a raw OutOfMemoryError. */
    public final Set<Backend> oomErrorBackends = EnumSet.noneOf(Backend.class);
    public volatile AnalysisException initFailure;

    public final List<Backend> initializeCalls = Collections.synchronizedList(new ArrayList<>());
    public volatile int releaseCalls = 0;
    public volatile int runCalls = 0;
    public volatile DetectionParameters lastParameters;
    /** When set, run() signals runStarted and then blocks until the gate opens. */
    public volatile CountDownLatch runGate;
    public final CountDownLatch runStarted = new CountDownLatch(1);

    public FakeModelEngine(Backend... supported) {
        this.supported = supported.length == 0 ? EnumSet.of(Backend.CPU) : EnumSet.of(supported[0], supported);
    }

    @Override
    public Set<Backend> supportedBackends() {
        return supported;
    }

    @Override
    public void initialize(Backend backend) throws AnalysisException {
        initializeCalls.add(backend);
        if (oomErrorBackends.contains(backend)) {
            throw new OutOfMemoryError("simulated " + backend + " allocation failure");
        }
        if (oomBackends.contains(backend)) {
            throw AnalysisException.outOfMemory("not enough memory for " + backend, null);
        }
        if (initFailure != null) {
            throw initFailure;
        }
    }

    @Override
    public SafetyAnalysis run(byte[] image, WorkType workType, DetectionParameters parameters)
            throws InterruptedException {
        runCalls++;
        lastParameters = parameters;
        CountDownLatch gate = runGate;
        if (gate != null) {
            runStarted.countDown();
            gate.await();
        }
        return SafetyAnalysis.builder(workType)
                .overallRiskLevel(RiskLevel.LOW)
                .confidence(0.8f)
                .build();
    }

    @Override
    public void release() {
        releaseCalls++;
    }
}
