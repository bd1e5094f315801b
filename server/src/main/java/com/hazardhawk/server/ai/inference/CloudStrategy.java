package com.hazardhawk.server.ai.inference;

import com.hazardhawk.server.ai.AnalysisCapability;
import com.hazardhawk.server.ai.AnalysisType;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.device.PerformanceTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Delegates to a remote vision service. Available only while configured and connected.
 */
public class CloudStrategy implements AnalyzerStrategy {

    private static final Logger logger = LoggerFactory.getLogger(CloudStrategy.class);

    private static final Set<AnalysisCapability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(
            AnalysisCapability.MULTIMODAL_VISION,
            AnalysisCapability.PPE_DETECTION,
            AnalysisCapability.HAZARD_IDENTIFICATION,
            AnalysisCapability.OSHA_COMPLIANCE));

    private final String name;
    private final int priority;
    private final PerformanceTier minimumTier;
    private final CloudAnalysisClient client;
    private final ConnectivityMonitor connectivity;

    public CloudStrategy(String name, int priority, PerformanceTier minimumTier, CloudAnalysisClient client,
            ConnectivityMonitor connectivity) {
        this.name = name;
        this.priority = priority;
        this.minimumTier = minimumTier != null ? minimumTier : PerformanceTier.LOW;
        this.client = client;
        this.connectivity = connectivity;
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
        return AnalysisType.CLOUD;
    }

    @Override
    public PerformanceTier getMinimumTier() {
        return minimumTier;
    }

    @Override
    public boolean isAvailable() {
        return client.isConfigured() && connectivity.isConnected();
    }

    @Override
    public void configure(String credential) throws AnalysisException {
        if (credential == null || credential.trim().isEmpty()) {
            throw AnalysisException.configuration(name + " requires a credential");
        }
        client.configure(credential);
        logger.info("{}: client configured", name);
    }

    @Override
    public SafetyAnalysis analyze(byte[] image, WorkType workType) throws AnalysisException, InterruptedException {
        if (!client.isConfigured()) {
            throw AnalysisException.configuration(name + " is not configured");
        }
        if (!connectivity.isConnected()) {
            throw AnalysisException.unavailable(name + ": no network connection");
        }
        return client.analyze(image, workType);
    }
}
