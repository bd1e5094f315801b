package com.hazardhawk.server.ai.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Probe for a Linux host running the server: reads the JVM runtime, procfs and sysfs.
 */
public class JvmPlatformProbe implements PlatformProbe {

    private static final Logger logger = LoggerFactory.getLogger(JvmPlatformProbe.class);

    private static final Pattern PROCESSOR_LINE = Pattern.compile("(?m)^processor\\s*:\\s*\\d+");
    private static final Path CPU_INFO = Paths.get("/proc/cpuinfo");
    private static final Path THERMAL_ZONE = Paths.get("/sys/class/thermal/thermal_zone0/temp");
    // Policy cap rather than scaling_cur_freq: an idle core clocks down without being throttled.
    private static final Path CPU_POLICY_MAX_FREQ = Paths.get("/sys/devices/system/cpu/cpu0/cpufreq/scaling_max_freq");
    private static final Path CPU_MAX_FREQ = Paths.get("/sys/devices/system/cpu/cpu0/cpufreq/cpuinfo_max_freq");
    private static final List<Path> GPU_NODES = List.of(Paths.get("/dev/nvidia0"), Paths.get("/dev/dri/renderD128"));
    private static final Path NPU_NODE = Paths.get("/dev/accel");

    @Override
    public long availableMemoryMb() {
        return Runtime.getRuntime().maxMemory() / 1024 / 1024;
    }

    @Override
    public int cpuCoreCount() {
        if (Files.isReadable(CPU_INFO)) {
            try {
                String cpuInfo = new String(Files.readAllBytes(CPU_INFO), StandardCharsets.UTF_8);
                Matcher matcher = PROCESSOR_LINE.matcher(cpuInfo);
                int count = 0;
                while (matcher.find()) {
                    count++;
                }
                if (count > 0) {
                    return count;
                }
            } catch (IOException e) {
                logger.debug("Could not read {}: {}", CPU_INFO, e.getMessage());
            }
        }
        return Runtime.getRuntime().availableProcessors();
    }

    @Override
    public boolean hasGpu() {
        for (Path node : GPU_NODES) {
            if (Files.exists(node)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean hasNpu() {
        return Files.isDirectory(NPU_NODE);
    }

    @Override
    public int platformVersion() {
        return Runtime.version().feature();
    }

    @Override
    public int smallestScreenWidthDp() {
        return -1;
    }

    @Override
    public String productIdentifier() {
        return System.getProperty("os.name", "") + " " + System.getProperty("os.arch", "");
    }

    @Override
    public double temperatureCelsius() {
        long milliCelsius = readLong(THERMAL_ZONE);
        return milliCelsius == Long.MIN_VALUE ? Double.NaN : milliCelsius / 1000.0;
    }

    @Override
    public long currentCpuFrequencyKhz() {
        long v = readLong(CPU_POLICY_MAX_FREQ);
        return v == Long.MIN_VALUE ? 0 : v;
    }

    @Override
    public long maxCpuFrequencyKhz() {
        long v = readLong(CPU_MAX_FREQ);
        return v == Long.MIN_VALUE ? 0 : v;
    }

    @Override
    public double memoryUsageRatio() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return (double) used / (double) runtime.maxMemory();
    }

    private static long readLong(Path path) {
        if (!Files.isReadable(path)) {
            return Long.MIN_VALUE;
        }
        try {
            String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8).trim();
            return Long.parseLong(text);
        } catch (IOException | NumberFormatException e) {
            logger.debug("Could not read {}: {}", path, e.getMessage());
            return Long.MIN_VALUE;
        }
    }
}
