package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.AnalysisRequest;
import com.hazardhawk.server.ai.AnalysisType;
import com.hazardhawk.server.ai.DetectionParameters;
import com.hazardhawk.server.ai.OrchestratorConfig;
import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.device.CapabilityAssessor;
import com.hazardhawk.server.ai.device.DeviceCapability;
import com.hazardhawk.server.ai.device.MemoryPressure;
import com.hazardhawk.server.ai.inference.AnalysisException;
import com.hazardhawk.server.ai.inference.AnalyzerStrategy;
import com.hazardhawk.server.ai.inference.ConnectivityMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches analysis requests across a priority-ordered chain of strategies.
 *
 * <p>Per request: validate, check the result cache, join an identical in-flight request if one
 * exists, wait for the rate limiter, then try each strategy in turn under its own timeout until
 * one succeeds. A strategy that is disabled, unavailable or above the device's tier is skipped
 * before any clock starts. Only {@link AllStrategiesExhaustedException} escapes a failed cascade.
 */
public class AnalysisCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisCoordinator.class);

    static final List<String> DEGRADED_CAVEATS = Collections.unmodifiableList(Arrays.asList(
            "Limited analysis - advanced AI services unavailable",
            "Manual safety review recommended for comprehensive assessment"));
    static final String CLOUD_FALLBACK_NOTE = "Analysis completed via cloud service (on-device analysis unavailable)";

    private final List<AnalyzerStrategy> strategies;
    private final CapabilityAssessor assessor;
    private final ConnectivityMonitor connectivity;
    private final OrchestratorConfig config;
    private final ResultCache cache;
    private final RequestRateLimiter rateLimiter;
    private final StatsTracker stats;
    private final InFlightRequests inFlight = new InFlightRequests();
    private final ExecutorService executor;
    private final Set<AnalysisType> disabled = ConcurrentHashMap.newKeySet();

    private volatile DetectionParameters detectionParameters;
    private volatile boolean shutdown;

    public AnalysisCoordinator(List<AnalyzerStrategy> strategies, CapabilityAssessor assessor,
            ConnectivityMonitor connectivity, OrchestratorConfig config) {
        this(strategies, assessor, connectivity, config, newCache(config),
                new RequestRateLimiter(config.rateLimit.targetFps), new StatsTracker(config.stats.rollingWindow));
    }

    public AnalysisCoordinator(List<AnalyzerStrategy> strategies, CapabilityAssessor assessor,
            ConnectivityMonitor connectivity, OrchestratorConfig config, ResultCache cache,
            RequestRateLimiter rateLimiter, StatsTracker stats) {
        List<AnalyzerStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparingInt(AnalyzerStrategy::getPriority).reversed());
        this.strategies = Collections.unmodifiableList(ordered);
        this.assessor = assessor;
        this.connectivity = connectivity;
        this.config = config;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.stats = stats;
        this.executor = Executors.newCachedThreadPool(new WorkerThreadFactory());
        if (config.disabledStrategies != null) {
            disabled.addAll(config.disabledStrategies);
        }
        DetectionParameters initial = config.detection != null
                ? new DetectionParameters(config.detection.confidenceThreshold, config.detection.iouThreshold)
                : DetectionParameters.defaults();
        applyDetectionParameters(initial);
        logger.info("Analysis coordinator ready with strategies {} (disabled: {})", strategyNames(), disabled);
    }

    private static ResultCache newCache(OrchestratorConfig config) {
        if (config.cache == null || !config.cache.enabled) {
            return null;
        }
        return new ResultCache(config.cache.ttlMs, config.cache.maxEntries);
    }

    public SafetyAnalysis analyze(byte[] image, WorkType workType)
            throws AllStrategiesExhaustedException, InterruptedException {
        return analyze(new AnalysisRequest(image, workType));
    }

    public SafetyAnalysis analyze(AnalysisRequest request)
            throws AllStrategiesExhaustedException, InterruptedException {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        if (shutdown) {
            throw new IllegalStateException("Coordinator has been shut down");
        }
        stats.recordRequest();
        String fingerprint = request.getFingerprint();

        SafetyAnalysis cached = lookupCache(fingerprint);
        if (cached != null) {
            return cached;
        }
        if (config.coalesceInFlight) {
            return inFlight.execute(fingerprint, () -> runCascade(request, fingerprint));
        }
        return runCascade(request, fingerprint);
    }

    /**
     * Runs {@link #analyze(AnalysisRequest)} on the worker pool. Cancelling the returned future
     * with interruption aborts the strategy attempt in progress.
     */
    public Future<SafetyAnalysis> analyzeAsync(AnalysisRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        return executor.submit(() -> analyze(request));
    }

    public List<BatchItemResult> analyzeBatch(List<AnalysisRequest> requests) throws InterruptedException {
        return analyzeBatch(requests, config.batchConcurrency);
    }

    /**
     * Analyzes every request with at most {@code maxConcurrency} running at once. Results come
     * back in request order; one failure does not affect the others.
     */
    public List<BatchItemResult> analyzeBatch(List<AnalysisRequest> requests, int maxConcurrency)
            throws InterruptedException {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        if (requests == null || requests.isEmpty()) {
            return Collections.emptyList();
        }
        Semaphore permits = new Semaphore(maxConcurrency);
        List<Future<SafetyAnalysis>> futures = new ArrayList<>(requests.size());
        for (AnalysisRequest request : requests) {
            futures.add(executor.submit(() -> {
                permits.acquire();
                try {
                    return analyze(request);
                } finally {
                    permits.release();
                }
            }));
        }

        List<BatchItemResult> results = new ArrayList<>(requests.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(BatchItemResult.success(i, futures.get(i).get()));
                } catch (ExecutionException e) {
                    results.add(BatchItemResult.failure(i, e.getCause()));
                }
            }
        } catch (InterruptedException e) {
            for (Future<SafetyAnalysis> f : futures) {
                f.cancel(true);
            }
            throw e;
        }
        logger.info("Batch of {} analyzed", requests.size());
        return results;
    }

    private SafetyAnalysis lookupCache(String fingerprint) {
        if (cache == null) {
            return null;
        }
        SafetyAnalysis hit = cache.get(fingerprint);
        if (hit != null) {
            stats.recordCacheHit();
            logger.debug("Cache hit for {}", fingerprint);
        } else {
            logger.debug("Cache miss for {}", fingerprint);
        }
        return hit;
    }

    private SafetyAnalysis runCascade(AnalysisRequest request, String fingerprint)
            throws AllStrategiesExhaustedException, InterruptedException {
        // a previous leader for this fingerprint may have finished in the meantime
        SafetyAnalysis cached = lookupCache(fingerprint);
        if (cached != null) {
            return cached;
        }

        long waitedMs = rateLimiter.acquire();
        if (waitedMs > 0) {
            logger.debug("Rate limiter delayed request by {}ms", waitedMs);
        }

        long cascadeStart = System.nanoTime();
        DeviceCapability capability = assessor.assess();
        List<StrategyAttempt> attempts = new ArrayList<>();
        Throwable lastError = null;

        for (int i = 0; i < strategies.size(); i++) {
            AnalyzerStrategy strategy = strategies.get(i);
            String name = strategy.getName();
            AnalysisType type = strategy.getAnalysisType();

            StrategyAttempt.Outcome skip = skipReason(strategy, capability);
            if (skip != null) {
                logger.debug("Skipping {}: {}", name, skip);
                stats.recordSkipped(type);
                attempts.add(StrategyAttempt.skipped(name, type, skip));
                continue;
            }

            long timeoutMs = timeoutFor(strategy, capability);
            long attemptStart = System.nanoTime();
            try {
                SafetyAnalysis raw = runWithTimeout(strategy, request, timeoutMs);
                long elapsedMs = elapsedMs(attemptStart);
                stats.recordSuccess(type, elapsedMs);
                attempts.add(new StrategyAttempt(name, type, StrategyAttempt.Outcome.SUCCEEDED, elapsedMs, null));

                SafetyAnalysis result = adjust(raw, strategy, i, elapsedMs(cascadeStart));
                if (cache != null) {
                    cache.put(fingerprint, result);
                }
                logger.info("Analysis {} completed by {} in {}ms", result.getId(), name, result.getProcessingTimeMs());
                return result;
            } catch (TimeoutException e) {
                long elapsedMs = elapsedMs(attemptStart);
                stats.recordTimeout(type, elapsedMs);
                lastError = AnalysisException.timeout(name + " timed out after " + timeoutMs + "ms");
                attempts.add(new StrategyAttempt(name, type, StrategyAttempt.Outcome.TIMED_OUT, elapsedMs, lastError));
                logger.warn("{} timed out after {}ms, trying next strategy", name, timeoutMs);
            } catch (AnalysisException e) {
                long elapsedMs = elapsedMs(attemptStart);
                stats.recordFailure(type, elapsedMs);
                lastError = e;
                attempts.add(new StrategyAttempt(name, type, StrategyAttempt.Outcome.FAILED, elapsedMs, e));
                logger.warn("{} failed ({}): {}", name, e.getKind(), e.getMessage());
            }
        }

        stats.recordExhausted();
        AllStrategiesExhaustedException exhausted = new AllStrategiesExhaustedException(attempts, lastError);
        logger.warn(exhausted.getMessage());
        throw exhausted;
    }

    private StrategyAttempt.Outcome skipReason(AnalyzerStrategy strategy, DeviceCapability capability) {
        if (disabled.contains(strategy.getAnalysisType())) {
            return StrategyAttempt.Outcome.SKIPPED_DISABLED;
        }
        if (!capability.getTier().isAtLeast(strategy.getMinimumTier())) {
            return StrategyAttempt.Outcome.SKIPPED_TIER;
        }
        if (!probeAvailable(strategy)) {
            return StrategyAttempt.Outcome.SKIPPED_UNAVAILABLE;
        }
        return null;
    }

    private boolean probeAvailable(AnalyzerStrategy strategy) {
        try {
            return strategy.isAvailable();
        } catch (RuntimeException e) {
            logger.warn("Availability probe for {} failed: {}", strategy.getName(), e.toString());
            return false;
        }
    }

    long timeoutFor(AnalyzerStrategy strategy, DeviceCapability capability) {
        OrchestratorConfig.Timeouts t = config.timeouts;
        long base;
        switch (strategy.getAnalysisType()) {
            case CLOUD:
                base = t.cloudMs;
                break;
            case LOCAL_FALLBACK:
                base = t.fallbackMs;
                break;
            default:
                switch (capability.getTier()) {
                    case HIGH:
                        base = t.highTierMs;
                        break;
                    case MEDIUM:
                        base = t.mediumTierMs;
                        break;
                    default:
                        base = t.lowTierMs;
                }
        }
        boolean throttled;
        try {
            throttled = strategy.isThermallyThrottled();
        } catch (RuntimeException e) {
            logger.warn("Thermal check for {} failed: {}", strategy.getName(), e.toString());
            throttled = false;
        }
        if (throttled) {
            long reduced = Math.max(1, (long) (base * t.thermalTimeoutFactor));
            logger.info("{} is thermally throttled, timeout reduced to {}ms", strategy.getName(), reduced);
            return reduced;
        }
        return base;
    }

    private SafetyAnalysis runWithTimeout(AnalyzerStrategy strategy, AnalysisRequest request, long timeoutMs)
            throws AnalysisException, TimeoutException, InterruptedException {
        byte[] image = request.getImage();
        WorkType workType = request.getWorkType();
        Future<SafetyAnalysis> attempt;
        try {
            attempt = executor.submit(() -> strategy.analyze(image, workType));
        } catch (RejectedExecutionException e) {
            throw AnalysisException.unavailable("Coordinator is shutting down");
        }
        try {
            SafetyAnalysis result = attempt.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                throw AnalysisException.inference(strategy.getName() + " returned no result");
            }
            return result;
        } catch (TimeoutException | InterruptedException e) {
            attempt.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnalysisException) {
                throw (AnalysisException) cause;
            }
            if (cause instanceof OutOfMemoryError) {
                throw AnalysisException.outOfMemory(strategy.getName() + " ran out of memory", cause);
            }
            throw AnalysisException.inference(strategy.getName() + " failed: " + cause, cause);
        }
    }

    private SafetyAnalysis adjust(SafetyAnalysis raw, AnalyzerStrategy strategy, int position, long totalMs) {
        SafetyAnalysis result = raw.withAnalysisType(strategy.getAnalysisType());
        if (strategy.isDegraded()) {
            float scaled = (float) (raw.getConfidence() * config.degradedConfidenceFactor);
            result = result.withConfidence(Math.max(0f, Math.min(1f, scaled)))
                    .withAdditionalRecommendations(DEGRADED_CAVEATS);
        } else if (strategy.getAnalysisType() == AnalysisType.CLOUD && position > 0) {
            result = result.withAdditionalRecommendations(Collections.singletonList(CLOUD_FALLBACK_NOTE));
        }
        return result.withProcessingTimeMs(totalMs);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Configures every strategy with the credential.
     *
     * @return names of the strategies that accepted it
     * @throws AnalysisException if none did
     */
    public List<String> configure(String credential) throws AnalysisException {
        List<String> configured = new ArrayList<>();
        List<AnalysisException> errors = new ArrayList<>();
        for (AnalyzerStrategy strategy : strategies) {
            try {
                strategy.configure(credential);
                configured.add(strategy.getName());
            } catch (AnalysisException e) {
                logger.warn("Failed to configure {}: {}", strategy.getName(), e.getMessage());
                errors.add(e);
            }
        }
        if (configured.isEmpty()) {
            AnalysisException failure = AnalysisException.configuration("No analysis strategy could be configured");
            for (AnalysisException e : errors) {
                failure.addSuppressed(e);
            }
            throw failure;
        }
        logger.info("Configured strategies: {}", configured);
        return configured;
    }

    /** First strategy that would be attempted right now, if any. */
    public Optional<AnalyzerStrategy> bestAvailableStrategy() {
        DeviceCapability capability = assessor.assess();
        for (AnalyzerStrategy strategy : strategies) {
            if (skipReason(strategy, capability) == null) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }

    public HealthCheckResult healthCheck() {
        OrchestratorStats snapshot = stats.snapshot();
        OrchestratorConfig.Stats statsConfig = config.stats;
        List<StrategyHealth> health = new ArrayList<>();
        for (AnalyzerStrategy strategy : strategies) {
            long probeStart = System.nanoTime();
            boolean available = probeAvailable(strategy);
            double probeMs = (System.nanoTime() - probeStart) / 1_000_000.0;

            StrategyStats s = snapshot.forType(strategy.getAnalysisType());
            boolean belowFloor = s.getRollingSamples() >= statsConfig.minSamplesForFloor
                    && s.getRollingSuccessRate() < statsConfig.successFloor;
            health.add(new StrategyHealth(strategy.getName(), strategy.getAnalysisType(), available,
                    disabled.contains(strategy.getAnalysisType()), probeMs, s.getAverageLatencyMs(),
                    s.getRollingSuccessRate(), belowFloor));
        }
        boolean connected = false;
        if (connectivity != null) {
            try {
                connected = connectivity.isConnected();
            } catch (RuntimeException e) {
                logger.warn("Connectivity probe failed: {}", e.toString());
            }
        }
        HealthCheckResult result = new HealthCheckResult(health, connected, statsConfig.successFloor,
                System.currentTimeMillis());
        if (!result.isOverallHealthy()) {
            logger.warn("Health check: no strategy available");
        }
        return result;
    }

    public void updateDetectionParameters(float confidenceThreshold, float iouThreshold) {
        applyDetectionParameters(new DetectionParameters(confidenceThreshold, iouThreshold));
        logger.info("Detection parameters updated: {}", detectionParameters);
    }

    private void applyDetectionParameters(DetectionParameters parameters) {
        detectionParameters = parameters;
        for (AnalyzerStrategy strategy : strategies) {
            strategy.updateDetectionParameters(parameters);
        }
    }

    public DetectionParameters getDetectionParameters() {
        return detectionParameters;
    }

    public void disableStrategy(AnalysisType type) {
        if (disabled.add(type)) {
            logger.warn("Strategy {} disabled", type);
        }
    }

    public void enableStrategy(AnalysisType type) {
        if (disabled.remove(type)) {
            logger.info("Strategy {} re-enabled", type);
        }
    }

    public Set<AnalysisType> getDisabledStrategies() {
        Set<AnalysisType> copy = EnumSet.noneOf(AnalysisType.class);
        copy.addAll(disabled);
        return copy;
    }

    public DeviceCapability getDeviceCapability() {
        return assessor.assess();
    }

    public OrchestratorStats getStats() {
        return stats.snapshot();
    }

    public void resetStats() {
        stats.reset();
        logger.info("Statistics reset");
    }

    public int clearCache() {
        return cache == null ? 0 : cache.clear();
    }

    /** Sheds cached results according to the current memory pressure. */
    public int relieveMemoryPressure() {
        if (cache == null) {
            return 0;
        }
        MemoryPressure pressure = assessor.currentMemoryPressure();
        return cache.onMemoryPressure(pressure);
    }

    public int getCacheSize() {
        return cache == null ? 0 : cache.size();
    }

    public List<AnalyzerStrategy> getStrategies() {
        return strategies;
    }

    public void shutdown() {
        shutdown = true;
        executor.shutdownNow();
        logger.info("Analysis coordinator shut down");
    }

    private List<String> strategyNames() {
        List<String> names = new ArrayList<>();
        for (AnalyzerStrategy s : strategies) {
            names.add(s.getName());
        }
        return names;
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "analysis-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
