package com.kubelab.api.api;

import com.kubelab.api.config.KubeLabProperties;
import java.time.Clock;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Blue/green routing targets. */
@RestController
@RequestMapping("/deployment")
public class DeploymentController {

    private final KubeLabProperties properties;
    private final Clock clock;

    public DeploymentController(KubeLabProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/version")
    public Map<String, Object> version() {
        return Map.of(
                "deployment_version", properties.deploymentVersion(),
                "app_version", properties.version(),
                "environment", properties.environment(),
                "timestamp", clock.instant().toString());
    }

    @GetMapping("/blue")
    public Map<String, Object> blue() {
        return color("blue", "BLUE", "#0066CC");
    }

    @GetMapping("/green")
    public Map<String, Object> green() {
        return color("green", "GREEN", "#00CC66");
    }

    private Map<String, Object> color(String deployment, String label, String hex) {
        return Map.of(
                "deployment", deployment,
                "message", "This is the " + label + " deployment",
                "version", properties.version(),
                "color", hex,
                "timestamp", clock.instant().toString());
    }
}
