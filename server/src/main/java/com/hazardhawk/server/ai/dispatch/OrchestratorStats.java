package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.AnalysisType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only snapshot of coordinator statistics. Derived values are computed on read.
 */
public class OrchestratorStats {
    private final Map<AnalysisType, StrategyStats> strategies;
    private final long totalRequests;
    private final long cacheHits;
    private final long exhaustedRequests;

    public OrchestratorStats(Map<AnalysisType, StrategyStats> strategies, long totalRequests, long cacheHits,
            long exhaustedRequests) {
        EnumMap<AnalysisType, StrategyStats> copy = new EnumMap<>(AnalysisType.class);
        for (AnalysisType type : AnalysisType.values()) {
            StrategyStats s = strategies.get(type);
            copy.put(type, s != null ? s : StrategyStats.empty(type));
        }
        this.strategies = Collections.unmodifiableMap(copy);
        this.totalRequests = totalRequests;
        this.cacheHits = cacheHits;
        this.exhaustedRequests = exhaustedRequests;
    }

    public Map<AnalysisType, StrategyStats> getStrategies() {
        return strategies;
    }

    public StrategyStats forType(AnalysisType type) {
        return strategies.get(type);
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public long getCacheHits() {
        return cacheHits;
    }

    public long getExhaustedRequests() {
        return exhaustedRequests;
    }

    public long getTotalSuccesses() {
        long total = 0;
        for (StrategyStats s : strategies.values()) {
            total += s.getSuccesses();
        }
        return total;
    }

    public double getOverallSuccessRate() {
        long attempts = 0;
        for (StrategyStats s : strategies.values()) {
            attempts += s.getAttempts();
        }
        return attempts == 0 ? 0.0 : (double) getTotalSuccesses() / attempts;
    }

    public double getAverageLatencyMs() {
        long attempts = 0;
        long latency = 0;
        for (StrategyStats s : strategies.values()) {
            attempts += s.getAttempts();
            latency += s.getTotalLatencyMs();
        }
        return attempts == 0 ? 0.0 : (double) latency / attempts;
    }

    public double getCacheHitRate() {
        return totalRequests == 0 ? 0.0 : (double) cacheHits / totalRequests;
    }

    /**
     * The strategy type that has produced the most results, or null before the first success.
     */
    public AnalysisType getPreferredStrategy() {
        AnalysisType best = null;
        long bestCount = 0;
        for (StrategyStats s : strategies.values()) {
            if (s.getSuccesses() > bestCount) {
                best = s.getAnalysisType();
                bestCount = s.getSuccesses();
            }
        }
        return best;
    }

    @Override
    public String toString() {
        return "OrchestratorStats{requests=" + totalRequests + ", cacheHits=" + cacheHits + ", exhausted="
                + exhaustedRequests + ", strategies=" + strategies.values() + '}';
    }
}
