package com.hazardhawk.server.ai.device;

/**
 * Hardware classification of the host, computed once by {@link CapabilityAssessor}.
 */
public class DeviceCapability {
    private final DeviceType deviceType;
    private final long availableMemoryMb;
    private final int cpuCores;
    private final boolean hasGpu;
    private final boolean hasNpu;
    private final int platformVersion;
    private final int score;
    private final PerformanceTier tier;

    public DeviceCapability(DeviceType deviceType, long availableMemoryMb, int cpuCores, boolean hasGpu,
            boolean hasNpu, int platformVersion, int score, PerformanceTier tier) {
        this.deviceType = deviceType;
        this.availableMemoryMb = availableMemoryMb;
        this.cpuCores = cpuCores;
        this.hasGpu = hasGpu;
        this.hasNpu = hasNpu;
        this.platformVersion = platformVersion;
        this.score = score;
        this.tier = tier;
    }

    /**
     * Used when probing fails: LOW tier, 4 cores, 1024MB, no accelerators.
     */
    public static DeviceCapability conservativeDefault() {
        return new DeviceCapability(DeviceType.PHONE, 1024, 4, false, false, 0, 0, PerformanceTier.LOW);
    }

    public DeviceType getDeviceType() {
        return deviceType;
    }

    public long getAvailableMemoryMb() {
        return availableMemoryMb;
    }

    public int getCpuCores() {
        return cpuCores;
    }

    public boolean isHasGpu() {
        return hasGpu;
    }

    public boolean isHasNpu() {
        return hasNpu;
    }

    public int getPlatformVersion() {
        return platformVersion;
    }

    public int getScore() {
        return score;
    }

    public PerformanceTier getTier() {
        return tier;
    }

    @Override
    public String toString() {
        return "DeviceCapability{" +
                "type=" + deviceType +
                ", memoryMb=" + availableMemoryMb +
                ", cores=" + cpuCores +
                ", gpu=" + hasGpu +
                ", npu=" + hasNpu +
                ", platform=" + platformVersion +
                ", score=" + score +
                ", tier=" + tier +
                '}';
    }
}
