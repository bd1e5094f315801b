package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.AnalysisType;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters behind {@link OrchestratorStats}. Counters are atomics; each strategy's
 * rolling window is a small ring buffer guarded by its own lock.
 */
public class StatsTracker {

    private final int rollingWindow;
    private final Map<AnalysisType, Counters> counters = new EnumMap<>(AnalysisType.class);
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong exhaustedRequests = new AtomicLong();

    public StatsTracker(int rollingWindow) {
        if (rollingWindow <= 0) {
            throw new IllegalArgumentException("rollingWindow must be positive, got " + rollingWindow);
        }
        this.rollingWindow = rollingWindow;
        for (AnalysisType type : AnalysisType.values()) {
            counters.put(type, new Counters(rollingWindow));
        }
    }

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    public void recordCacheHit() {
        cacheHits.incrementAndGet();
    }

    public void recordExhausted() {
        exhaustedRequests.incrementAndGet();
    }

    public void recordSuccess(AnalysisType type, long latencyMs) {
        Counters c = counters.get(type);
        c.successes.incrementAndGet();
        c.latencyMs.addAndGet(latencyMs);
        c.window.add(true);
    }

    public void recordFailure(AnalysisType type, long latencyMs) {
        Counters c = counters.get(type);
        c.failures.incrementAndGet();
        c.latencyMs.addAndGet(latencyMs);
        c.window.add(false);
    }

    public void recordTimeout(AnalysisType type, long latencyMs) {
        Counters c = counters.get(type);
        c.timeouts.incrementAndGet();
        c.latencyMs.addAndGet(latencyMs);
        c.window.add(false);
    }

    public void recordSkipped(AnalysisType type) {
        counters.get(type).skipped.incrementAndGet();
    }

    public OrchestratorStats snapshot() {
        Map<AnalysisType, StrategyStats> perType = new EnumMap<>(AnalysisType.class);
        for (Map.Entry<AnalysisType, Counters> e : counters.entrySet()) {
            Counters c = e.getValue();
            int[] rolling = c.window.read();
            perType.put(e.getKey(), new StrategyStats(e.getKey(), c.successes.get(), c.failures.get(),
                    c.timeouts.get(), c.skipped.get(), c.latencyMs.get(), rolling[0], rolling[1]));
        }
        return new OrchestratorStats(perType, totalRequests.get(), cacheHits.get(), exhaustedRequests.get());
    }

    public void reset() {
        totalRequests.set(0);
        cacheHits.set(0);
        exhaustedRequests.set(0);
        for (Counters c : counters.values()) {
            c.successes.set(0);
            c.failures.set(0);
            c.timeouts.set(0);
            c.skipped.set(0);
            c.latencyMs.set(0);
            c.window.clear();
        }
    }

    public int getRollingWindow() {
        return rollingWindow;
    }

    private static class Counters {
        final AtomicLong successes = new AtomicLong();
        final AtomicLong failures = new AtomicLong();
        final AtomicLong timeouts = new AtomicLong();
        final AtomicLong skipped = new AtomicLong();
        final AtomicLong latencyMs = new AtomicLong();
        final OutcomeWindow window;

        Counters(int size) {
            this.window = new OutcomeWindow(size);
        }
    }

    private static class OutcomeWindow {
        private final boolean[] outcomes;
        private int next;
        private int count;

        OutcomeWindow(int size) {
            this.outcomes = new boolean[size];
        }

        synchronized void add(boolean success) {
            outcomes[next] = success;
            next = (next + 1) % outcomes.length;
            if (count < outcomes.length) {
                count++;
            }
        }

        /** [samples, successes] */
        synchronized int[] read() {
            int successes = 0;
            for (int i = 0; i < count; i++) {
                if (outcomes[i]) {
                    successes++;
                }
            }
            return new int[] {count, successes};
        }

        synchronized void clear() {
            next = 0;
            count = 0;
        }
    }
}
