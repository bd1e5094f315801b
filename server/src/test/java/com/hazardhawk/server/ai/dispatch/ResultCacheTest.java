package com.hazardhawk.server.ai.dispatch;

import com.hazardhawk.server.ai.SafetyAnalysis;
import com.hazardhawk.server.ai.WorkType;
import com.hazardhawk.server.ai.device.MemoryPressure;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class ResultCacheTest {

    private final AtomicLong now = new AtomicLong(1_000);

    private static SafetyAnalysis analysis(String id) {
        return SafetyAnalysis.builder(WorkType.CONCRETE).id(id).build();
    }

    @Test
    public void testHitReturnsSameInstance() {
        ResultCache cache = new ResultCache(10_000, 10, now::get);
        SafetyAnalysis a = analysis("a");
        cache.put("fp", a);
        assertSame(a, cache.get("fp"));
        assertNull(cache.get("other"));
    }

    @Test
    public void testExpiredEntryIsRemovedOnLookup() {
        ResultCache cache = new ResultCache(10_000, 10, now::get);
        cache.put("fp", analysis("a"));

        now.addAndGet(9_999);
        assertNotNull(cache.get("fp"));
        now.addAndGet(1);
        assertNull(cache.get("fp"));
        assertEquals(0, cache.size());
    }

    @Test
    public void testEvictsLeastRecentlyInserted() {
        ResultCache cache = new ResultCache(10_000, 3, now::get);
        cache.put("a", analysis("a"));
        cache.put("b", analysis("b"));
        cache.put("c", analysis("c"));
        // reading does not refresh insertion order
        cache.get("a");
        cache.put("d", analysis("d"));

        assertNull(cache.get("a"));
        assertNotNull(cache.get("b"));
        assertEquals(3, cache.size());
    }

    @Test
    public void testRePutIsLastWriteWinsAndRefreshesOrder() {
        ResultCache cache = new ResultCache(10_000, 2, now::get);
        cache.put("a", analysis("a1"));
        cache.put("b", analysis("b"));
        cache.put("a", analysis("a2"));
        cache.put("c", analysis("c"));

        assertEquals("a2", cache.get("a").getId());
        assertNull(cache.get("b"));
    }

    @Test
    public void testMemoryPressureEviction() {
        ResultCache cache = new ResultCache(10_000, 20, now::get);
        for (int i = 0; i < 10; i++) {
            cache.put("k" + i, analysis("k" + i));
        }

        assertEquals(0, cache.onMemoryPressure(MemoryPressure.LOW));
        assertEquals(3, cache.onMemoryPressure(MemoryPressure.MEDIUM));
        assertNull(cache.get("k2"));
        assertNotNull(cache.get("k3"));

        assertEquals(5, cache.onMemoryPressure(MemoryPressure.HIGH));
        assertEquals(2, cache.size());
        assertEquals(2, cache.onMemoryPressure(MemoryPressure.CRITICAL));
        assertEquals(0, cache.size());
    }

    @Test
    public void testDefaultClockIsMonotonic() {
        long before = TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
        long reading = ResultCache.MONOTONIC_MILLIS.getAsLong();
        long after = TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
        assertTrue(reading >= before && reading <= after, "clock reading " + reading + " not in nanoTime range");

        ResultCache cache = new ResultCache(60_000, 10);
        cache.put("a", analysis("a"));
        assertNotNull(cache.get("a"));
    }

    @Test
    public void testInvalidSettingsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ResultCache(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new ResultCache(1000, 0));
    }
}
