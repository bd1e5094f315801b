package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.device.MemoryPressure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Fingerprint-keyed analysis cache with a fixed TTL and a bounded entry count. Expired entries
 * are dropped lazily on lookup; when full, the least recently inserted entry goes first.
 */
public class ResultCache {

    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    // monotonic; expiry only compares differences
    static final LongSupplier MONOTONIC_MILLIS = () -> TimeUnit.NANOSECONDS.toMillis(System.nanoTime());

    private final long ttlMs;
    private final int maxEntries;
    private final LongSupplier clock;

    // insertion-ordered; re-putting a key moves it to the tail
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();

    public ResultCache(long ttlMs, int maxEntries) {
        this(ttlMs, maxEntries, MONOTONIC_MILLIS);
    }

    public ResultCache(long ttlMs, int maxEntries, LongSupplier clock) {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive, got " + ttlMs);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.ttlMs = ttlMs;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * @return the cached analysis, or null on a miss or an expired entry
     */
    public SafetyAnalysis get(String fingerprint) {
        synchronized (entries) {
            CacheEntry entry = entries.get(fingerprint);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(clock.getAsLong(), ttlMs)) {
                entries.remove(fingerprint);
                logger.debug("Cache entry expired for {}", fingerprint);
                return null;
            }
            return entry.getAnalysis();
        }
    }

    public void put(String fingerprint, SafetyAnalysis analysis) {
        if (fingerprint == null || analysis == null) {
            throw new IllegalArgumentException("fingerprint and analysis are required");
        }
        synchronized (entries) {
            entries.remove(fingerprint);
            entries.put(fingerprint, new CacheEntry(fingerprint, analysis, clock.getAsLong()));
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (entries.size() > maxEntries && it.hasNext()) {
                it.next();
                it.remove();
            }
        }
    }

    /**
     * Sheds the oldest entries according to the pressure level.
     *
     * @return number of entries removed
     */
    public int onMemoryPressure(MemoryPressure pressure) {
        synchronized (entries) {
            int size = entries.size();
            int toRemove;
            switch (pressure) {
                case CRITICAL:
                    toRemove = size;
                    break;
                case HIGH:
                    toRemove = (int) Math.ceil(size * 0.6);
                    break;
                case MEDIUM:
                    toRemove = (int) Math.ceil(size * 0.3);
                    break;
                default:
                    toRemove = 0;
            }
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            int removed = 0;
            while (removed < toRemove && it.hasNext()) {
                it.next();
                it.remove();
                removed++;
            }
            if (removed > 0) {
                logger.info("Evicted {} of {} cached analyses under {} memory pressure", removed, size, pressure);
            }
            return removed;
        }
    }

    public int clear() {
        synchronized (entries) {
            int size = entries.size();
            entries.clear();
            return size;
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public long getTtlMs() {
        return ttlMs;
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
