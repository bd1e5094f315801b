package com.hazardhawk.server.ai.device;

/**
 * Raw hardware readings supplied by the host platform. Implementations may throw unchecked
 * exceptions (missing APIs, permission denial); callers must tolerate that.
 */
public interface PlatformProbe {

    long availableMemoryMb();

    int cpuCoreCount();

    boolean hasGpu();

    boolean hasNpu();

    int platformVersion();

    /** Smallest screen dimension in density-independent units, or -1 when there is no screen. */
    int smallestScreenWidthDp();

    /** Model, product and device names joined; used to spot TV-class hardware. */
    String productIdentifier();

    /** SoC temperature in Celsius, NaN when unreadable. */
    double temperatureCelsius();

    /** Current CPU frequency in kHz, 0 or less when unreadable. */
    long currentCpuFrequencyKhz();

    /** Maximum CPU frequency in kHz, 0 or less when unreadable. */
    long maxCpuFrequencyKhz();

    /** Used fraction of the memory available to this process, in [0, 1]. */
    double memoryUsageRatio();
}
