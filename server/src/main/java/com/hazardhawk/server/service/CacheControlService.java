package com.hazardhawk.server.service;

import com.hazardhawk.server.ai.dispatch.AnalysisCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CacheControlService {

    private static final Logger logger = LoggerFactory.getLogger(CacheControlService.class);

    private final AnalysisService analysisService;

    public CacheControlService(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    /**
     * Drops every cached analysis. Use after changing detection parameters or swapping models,
     * since cached results were produced with the old ones.
     */
    public int clearAll() {
        int removed = coordinator().clearCache();
        logger.info("Cleared {} cached analyses", removed);
        return removed;
    }

    /**
     * Evicts the oldest cached analyses according to the current heap pressure.
     */
    public int relieveMemoryPressure() {
        return coordinator().relieveMemoryPressure();
    }

    private AnalysisCoordinator coordinator() {
        AnalysisCoordinator coordinator = analysisService.getCoordinator();
        if (coordinator == null) {
            throw new IllegalStateException("Analysis service is not initialized");
        }
        return coordinator;
    }
}
