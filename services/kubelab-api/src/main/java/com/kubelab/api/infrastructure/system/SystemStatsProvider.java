package com.kubelab.api.infrastructure.system;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Host and process statistics reported by the health and load-test endpoints.
 *
 * <p>Memory and CPU figures come from the JDK's {@code com.sun.management} extension of the
 * operating system MX bean. On a JVM without it they read as zero.
 */
@Component
public class SystemStatsProvider {

    private static final Logger log = LoggerFactory.getLogger(SystemStatsProvider.class);

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final File diskRoot;
    private final String hostname;

    public SystemStatsProvider() {
        this(new File("/"));
    }

    SystemStatsProvider(File diskRoot) {
        this.diskRoot = diskRoot;
        this.hostname = resolveHostname();
    }

    /** Pod name inside Kubernetes ({@code HOSTNAME}), otherwise the local host name. */
    public String hostname() {
        return hostname;
    }

    /** {@code <hostname>-<pid>}, unique per replica. */
    public String instanceId() {
        return hostname + "-" + ProcessHandle.current().pid();
    }

    /** {@code <os name>-<os version>-<arch>}. */
    public String platform() {
        return System.getProperty("os.name") + "-" + System.getProperty("os.version")
                + "-" + System.getProperty("os.arch");
    }

    public String javaVersion() {
        return Runtime.version().toString();
    }

    public int cpuCount() {
        return Runtime.getRuntime().availableProcessors();
    }

    /** System-wide CPU load in percent, 0 when the JVM cannot tell. */
    public double cpuPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            double load = sunOs.getCpuLoad();
            return load < 0 ? 0.0 : round(load * 100);
        }
        return 0.0;
    }

    public MemorySnapshot memory() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            long total = sunOs.getTotalMemorySize();
            long free = sunOs.getFreeMemorySize();
            return MemorySnapshot.of(total, free);
        }
        return MemorySnapshot.of(0, 0);
    }

    /**
     * Percentage of the root filesystem in use, or {@code null} when it cannot be read.
     */
    public Double diskUsagePercent() {
        try {
            long total = diskRoot.getTotalSpace();
            if (total <= 0) {
                log.warn("Disk usage unavailable for {}", diskRoot);
                return null;
            }
            long usable = diskRoot.getUsableSpace();
            return round((total - usable) * 100.0 / total);
        } catch (SecurityException e) {
            log.warn("Disk usage unavailable for {}: {}", diskRoot, e.getMessage());
            return null;
        }
    }

    private static String resolveHostname() {
        String fromEnv = System.getenv("HOSTNAME");
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local host name: {}", e.getMessage());
            return "unknown";
        }
    }

    static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    /**
     * Physical memory in bytes. {@code available} and {@code free} both report the free memory
     * the JVM sees.
     */
    public record MemorySnapshot(long total, long available, double percent, long used, long free) {

        static MemorySnapshot of(long total, long free) {
            long used = Math.max(0, total - free);
            double percent = total > 0 ? round(used * 100.0 / total) : 0.0;
            return new MemorySnapshot(total, free, percent, used, free);
        }
    }
}
