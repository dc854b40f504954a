package com.kubelab.api.api;

import com.kubelab.api.config.KubeLabProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Root, ping and version endpoints.
 *
 * <p>{@code build_timestamp} is the instant this controller was created, which for a container
 * image started by Kubernetes is the rollout time of the replica.
 */
@RestController
public class ServiceInfoController {

    static final String WELCOME = "KubeLab Kubernetes Test Application";
    static final String DOCS_URL = "/actuator";

    private final KubeLabProperties properties;
    private final Clock clock;
    private final Instant startedAt;

    public ServiceInfoController(KubeLabProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        return Map.of(
                "message", WELCOME,
                "version", properties.version(),
                "environment", properties.environment(),
                "deployment_version", properties.deploymentVersion(),
                "docs_url", DOCS_URL,
                "timestamp", clock.instant().toString());
    }

    @GetMapping("/ping")
    public Map<String, Object> ping() {
        return Map.of("message", "pong", "timestamp", clock.instant().toString());
    }

    @GetMapping("/version")
    public Map<String, Object> version() {
        return Map.of(
                "version", properties.version(),
                "environment", properties.environment(),
                "deployment_version", properties.deploymentVersion(),
                "build_timestamp", startedAt.toString());
    }
}
