package com.hazardhawk.server.ai.device;

public class FakePlatformProbe implements PlatformProbe {
    public long memoryMb = 8192;
    public int cores = 8;
    public boolean gpu = true;
    public boolean npu = false;
    public int platformVersion = 21;
    public int screenDp = 411;
    public String product = "Pixel 8 Pro";
    public double temperature = Double.NaN;
    public long currentFreqKhz = 0;
    public long maxFreqKhz = 0;
    public double memoryRatio = 0.2;
    public boolean failHardware = false;
    public boolean failLive = false;
    public int hardwareReads = 0;

    public static FakePlatformProbe highEnd() {
        return new FakePlatformProbe();
    }

    public static FakePlatformProbe lowEnd() {
        FakePlatformProbe probe = new FakePlatformProbe();
        probe.memoryMb = 2048;
        probe.cores = 2;
        probe.gpu = false;
        probe.platformVersion = 11;
        return probe;
    }

    @Override
    public long availableMemoryMb() {
        hardwareReads++;
        if (failHardware) {
            throw new SecurityException("permission denied");
        }
        return memoryMb;
    }

    @Override
    public int cpuCoreCount() {
        return cores;
    }

    @Override
    public boolean hasGpu() {
        return gpu;
    }

    @Override
    public boolean hasNpu() {
        return npu;
    }

    @Override
    public int platformVersion() {
        return platformVersion;
    }

    @Override
    public int smallestScreenWidthDp() {
        return screenDp;
    }

    @Override
    public String productIdentifier() {
        return product;
    }

    @Override
    public double temperatureCelsius() {
        if (failLive) {
            throw new IllegalStateException("thermal service missing");
        }
        return temperature;
    }

    @Override
    public long currentCpuFrequencyKhz() {
        return currentFreqKhz;
    }

    @Override
    public long maxCpuFrequencyKhz() {
        return maxFreqKhz;
    }

    @Override
    public double memoryUsageRatio() {
        if (failLive) {
            throw new IllegalStateException("memory info missing");
        }
        return memoryRatio;
    }
}
