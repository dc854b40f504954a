package com.kubelab.api.api;

import com.kubelab.api.config.KubeLabProperties;
import com.kubelab.api.infrastructure.system.SystemStatsProvider;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness/readiness target with a snapshot of the host.
 *
 * <p>The status is always {@code healthy} while the process can answer. A host figure that
 * cannot be read is reported as {@code null}; it never fails the probe.
 */
@RestController
public class HealthController {

    private final KubeLabProperties properties;
    private final SystemStatsProvider stats;
    private final Clock clock;

    public HealthController(KubeLabProperties properties, SystemStatsProvider stats, Clock clock) {
        this.properties = properties;
        this.stats = stats;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        var memory = stats.memory();
        Map<String, Object> systemInfo = new LinkedHashMap<>();
        systemInfo.put("hostname", stats.hostname());
        systemInfo.put("platform", stats.platform());
        systemInfo.put("java_version", stats.javaVersion());
        systemInfo.put("cpu_count", stats.cpuCount());
        systemInfo.put("memory_total", memory.total());
        systemInfo.put("memory_available", memory.available());
        systemInfo.put("disk_usage", stats.diskUsagePercent());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", clock.instant().toString());
        body.put("version", properties.version());
        body.put("environment", properties.environment());
        body.put("deployment_version", properties.deploymentVersion());
        body.put("system_info", systemInfo);
        return body;
    }
}
