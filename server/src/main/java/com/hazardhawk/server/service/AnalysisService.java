package com.hazardhawk.server.service;

import com.hazardhawk.server.ai.OrchestratorConfig;
import com.hazardhawk.server.ai.device.CapabilityAssessor;
import com.hazardhawk.server.ai.device.JvmPlatformProbe;
import com.hazardhawk.server.ai.device.PlatformProbe;
import com.hazardhawk.server.ai.dispatch.AnalysisCoordinator;
import com.hazardhawk.server.ai.inference.AnalysisException;
import com.hazardhawk.server.ai.inference.AnalyzerStrategy;
import com.hazardhawk.server.ai.inference.AnalyzerStrategyFactory;
import com.hazardhawk.server.ai.inference.CloudAnalysisClient;
import com.hazardhawk.server.ai.inference.ConnectivityMonitor;
import com.hazardhawk.server.ai.inference.ModelEngine;
import com.hazardhawk.server.util.ConfigPathResolver;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Owns the coordinator for the lifetime of the server. Inference backends are optional beans
 * contributed by the deployment; whatever is present gets wired into the strategy chain.
 */
@Service
public class AnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisService.class);

    private final ObjectProvider<ModelEngine> acceleratedEngine;
    private final ObjectProvider<ModelEngine> fallbackEngine;
    private final ObjectProvider<CloudAnalysisClient> cloudClient;
    private final ObjectProvider<ConnectivityMonitor> connectivity;
    private final ObjectProvider<PlatformProbe> platformProbe;
    private final String cloudCredential;

    private volatile AnalysisCoordinator coordinator;
    private volatile boolean isReady = false;

    @Autowired
    public AnalysisService(@Qualifier("acceleratedModelEngine") ObjectProvider<ModelEngine> acceleratedEngine,
            @Qualifier("fallbackModelEngine") ObjectProvider<ModelEngine> fallbackEngine,
            ObjectProvider<CloudAnalysisClient> cloudClient,
            ObjectProvider<ConnectivityMonitor> connectivity,
            ObjectProvider<PlatformProbe> platformProbe,
            @Value("${hazardhawk.cloud.credential:}") String cloudCredential) {
        this.acceleratedEngine = acceleratedEngine;
        this.fallbackEngine = fallbackEngine;
        this.cloudClient = cloudClient;
        this.connectivity = connectivity;
        this.platformProbe = platformProbe;
        this.cloudCredential = cloudCredential;
    }

    /** Wraps an already built coordinator; used by tests and embedding code. */
    public AnalysisService(AnalysisCoordinator coordinator) {
        this.acceleratedEngine = null;
        this.fallbackEngine = null;
        this.cloudClient = null;
        this.connectivity = null;
        this.platformProbe = null;
        this.cloudCredential = null;
        this.coordinator = coordinator;
        this.isReady = true;
    }

    public boolean isReady() {
        return isReady;
    }

    public AnalysisCoordinator getCoordinator() {
        return coordinator;
    }

    @PostConstruct
    public void init() {
        if (coordinator != null) {
            return;
        }
        OrchestratorConfig config = ConfigPathResolver.loadConfig();
        PlatformProbe probe = platformProbe.getIfAvailable(JvmPlatformProbe::new);
        CapabilityAssessor assessor = new CapabilityAssessor(probe, config.device);
        ConnectivityMonitor monitor = connectivity.getIfAvailable();

        List<AnalyzerStrategy> strategies = AnalyzerStrategyFactory.create(config, assessor,
                acceleratedEngine.getIfAvailable(), cloudClient.getIfAvailable(), monitor,
                fallbackEngine.getIfAvailable());
        AnalysisCoordinator created = new AnalysisCoordinator(strategies, assessor, monitor, config);
        coordinator = created;

        new Thread(() -> {
            try {
                logger.info("Initializing analysis service...");
                logger.info("Device capability: {}", created.getDeviceCapability());
                if (!strategies.isEmpty()) {
                    String credential = cloudCredential == null || cloudCredential.isEmpty() ? null : cloudCredential;
                    created.configure(credential);
                }
                isReady = true;
                logger.info("Analysis service is ready.");
            } catch (AnalysisException e) {
                // strategies configure lazily on first use as well, so serving can start anyway
                logger.warn("Strategy configuration failed: {}", e.getMessage());
                isReady = true;
            } catch (Exception e) {
                logger.error("Failed to initialize analysis service", e);
            }
        }, "analysis-init").start();
    }

    @PreDestroy
    public void shutdown() {
        AnalysisCoordinator current = coordinator;
        if (current != null) {
            current.shutdown();
        }
    }
}
