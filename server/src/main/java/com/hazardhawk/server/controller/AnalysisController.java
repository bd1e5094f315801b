package com.hazardhawk.server.controller;

import com.hazardhawk.server.ai.AnalysisRequest;
import com.hazardhawk.server.ai.AnalysisType;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.dispatch.AllStrategiesExhaustedException;
import com.hazardhawk.server.ai.dispatch.AnalysisCoordinator;
import com.hazardhawk.server.service.AnalysisService;
import com.hazardhawk.server.service.CacheControlService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.Locale;

@RestController
public class AnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);
    private final AnalysisService analysisService;
    private final CacheControlService cacheControlService;

    public AnalysisController(AnalysisService analysisService, CacheControlService cacheControlService) {
        this.analysisService = analysisService;
        this.cacheControlService = cacheControlService;
    }

    public static class DetectionParametersRequest {
        public Float confidenceThreshold;
        public Float iouThreshold;
    }

    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestParam(value = "workType", required = false) String workType,
            @RequestBody(required = false) byte[] image) {
        if (!analysisService.isReady()) {
            return notReady();
        }

        WorkType type;
        AnalysisRequest request;
        try {
            type = parseWorkType(workType);
            request = new AnalysisRequest(image, type);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }

        logger.info("Received analysis request: workType={}, bytes={}", type, request.getImageSize());

        try {
            SafetyAnalysis result = analysisService.getCoordinator().analyze(request);
            return ResponseEntity.ok(result);
        } catch (AllStrategiesExhaustedException e) {
            return ResponseEntity.status(503).body(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(503).body("Analysis interrupted");
        }
    }

    @GetMapping("/device-capability")
    public ResponseEntity<?> deviceCapability() {
        if (!analysisService.isReady()) {
            return notReady();
        }
        return ResponseEntity.ok(analysisService.getCoordinator().getDeviceCapability());
    }

    @GetMapping("/stats")
    public ResponseEntity<?> stats() {
        if (!analysisService.isReady()) {
            return notReady();
        }
        return ResponseEntity.ok(analysisService.getCoordinator().getStats());
    }

    @PostMapping("/stats/reset")
    public ResponseEntity<?> resetStats() {
        if (!analysisService.isReady()) {
            return notReady();
        }
        analysisService.getCoordinator().resetStats();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        if (!analysisService.isReady()) {
            return notReady();
        }
        return ResponseEntity.ok(analysisService.getCoordinator().healthCheck());
    }

    @PutMapping("/detection-parameters")
    public ResponseEntity<?> updateDetectionParameters(@RequestBody DetectionParametersRequest request) {
        if (!analysisService.isReady()) {
            return notReady();
        }
        if (request == null || request.confidenceThreshold == null || request.iouThreshold == null) {
            return ResponseEntity.badRequest().body("Both confidenceThreshold and iouThreshold are required.");
        }
        AnalysisCoordinator coordinator = analysisService.getCoordinator();
        try {
            coordinator.updateDetectionParameters(request.confidenceThreshold, request.iouThreshold);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
        return ResponseEntity.ok(coordinator.getDetectionParameters());
    }

    @PostMapping("/strategies/{type}/disable")
    public ResponseEntity<?> disableStrategy(@PathVariable("type") String type) {
        return toggleStrategy(type, false);
    }

    @PostMapping("/strategies/{type}/enable")
    public ResponseEntity<?> enableStrategy(@PathVariable("type") String type) {
        return toggleStrategy(type, true);
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<?> clearCache() {
        if (!analysisService.isReady()) {
            return notReady();
        }
        return ResponseEntity.ok(Collections.singletonMap("removed", cacheControlService.clearAll()));
    }

    @PostMapping("/cache/relieve-pressure")
    public ResponseEntity<?> relieveMemoryPressure() {
        if (!analysisService.isReady()) {
            return notReady();
        }
        return ResponseEntity.ok(Collections.singletonMap("removed", cacheControlService.relieveMemoryPressure()));
    }

    private ResponseEntity<?> toggleStrategy(String type, boolean enable) {
        if (!analysisService.isReady()) {
            return notReady();
        }
        AnalysisType analysisType;
        try {
            analysisType = AnalysisType.valueOf(type.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Unknown strategy type: " + type);
        }
        AnalysisCoordinator coordinator = analysisService.getCoordinator();
        if (enable) {
            coordinator.enableStrategy(analysisType);
        } else {
            coordinator.disableStrategy(analysisType);
        }
        return ResponseEntity.ok(Collections.singletonMap("disabled", coordinator.getDisabledStrategies()));
    }

    private static WorkType parseWorkType(String workType) {
        if (workType == null || workType.trim().isEmpty()) {
            throw new IllegalArgumentException("workType is required.");
        }
        try {
            return WorkType.valueOf(workType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown workType: " + workType);
        }
    }

    private static ResponseEntity<?> notReady() {
        return ResponseEntity.status(503).body("Analysis service is still initializing, please try again later.");
    }
}
