package com.example.cicdbackend.monitoring;

import com.example.cicdbackend.config.BackendProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Samples CPU, memory and disk utilisation of the host.
 *
 * CPU is measured over {@code cicd-backend.system-info.cpu-sample-interval}:
 * the calling thread sleeps for that window, so a sample is never instantaneous.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HostResourceSampler {

    private static final Path MEMINFO = Paths.get("/proc/meminfo");

    private final BackendProperties properties;

    public record HostUsage(double cpuPercent, double memoryPercent, double diskPercent) {}

    public HostUsage sample() {
        return new HostUsage(
                round(cpuPercent(properties.getSystemInfo().getCpuSampleInterval())),
                round(memoryPercent()),
                round(diskPercent(properties.getSystemInfo().getDiskPath())));
    }

    double cpuPercent(Duration interval) {
        com.sun.management.OperatingSystemMXBean os = osBean();
        if (os == null) return 0.0;

        // The first reading opens the measurement window, the second closes it
        os.getCpuLoad();
        if (!interval.isZero() && !interval.isNegative()) {
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("CPU sampling interrupted, reporting partial window");
            }
        }
        double load = os.getCpuLoad();
        return load < 0 ? 0.0 : load * 100.0;
    }

    /**
     * Share of memory not available to new processes. Page cache counts as available,
     * so on Linux the figure comes from MemAvailable in /proc/meminfo.
     */
    double memoryPercent() {
        if (Files.isReadable(MEMINFO)) {
            try {
                OptionalDouble fromMeminfo = memoryPercent(Files.readAllLines(MEMINFO));
                if (fromMeminfo.isPresent()) return fromMeminfo.getAsDouble();
            } catch (IOException e) {
                log.debug("Cannot read {}: {}", MEMINFO, e.getMessage());
            }
        }
        com.sun.management.OperatingSystemMXBean os = osBean();
        if (os == null) return 0.0;
        long total = os.getTotalMemorySize();
        if (total <= 0) return 0.0;
        long used = total - os.getFreeMemorySize();
        return used * 100.0 / total;
    }

    static OptionalDouble memoryPercent(List<String> meminfo) {
        long total = -1;
        long available = -1;
        for (String line : meminfo) {
            if (line.startsWith("MemTotal:")) total = kilobytes(line);
            else if (line.startsWith("MemAvailable:")) available = kilobytes(line);
        }
        if (total <= 0 || available < 0) return OptionalDouble.empty();
        return OptionalDouble.of((total - available) * 100.0 / total);
    }

    private static long kilobytes(String line) {
        String[] parts = line.trim().split("\\s+");
        try {
            return parts.length > 1 ? Long.parseLong(parts[1]) : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    double diskPercent(String path) {
        try {
            FileStore store = Files.getFileStore(Paths.get(path));
            long used = store.getTotalSpace() - store.getUnallocatedSpace();
            long available = used + store.getUsableSpace();
            return available <= 0 ? 0.0 : used * 100.0 / available;
        } catch (IOException e) {
            log.warn("Cannot read disk usage of {}: {}", path, e.getMessage());
            return 0.0;
        }
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static com.sun.management.OperatingSystemMXBean osBean() {
        if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean os) {
            return os;
        }
        return null;
    }
}
