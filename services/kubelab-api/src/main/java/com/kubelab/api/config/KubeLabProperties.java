package com.kubelab.api.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from the {@code kubelab.service.*} prefix.
 *
 * <pre>
 * kubelab:
 *   service:
 *     name: kubelab-api
 *     version: 1.0.0
 *     environment: production
 *     deployment-version: green
 * </pre>
 *
 * @param name service name used in logs and {@code /actuator/info}. Required.
 * @param version application version reported by the info endpoints.
 * @param environment deployment environment (development, staging, production).
 * @param deploymentVersion blue/green color label of this deployment.
 */
@ConfigurationProperties(prefix = "kubelab.service")
@Validated
public record KubeLabProperties(
        @NotBlank String name, String version, String environment, String deploymentVersion) {

    /** Applies defaults for optional fields before Bean Validation runs. */
    public KubeLabProperties {
        if (version == null || version.isBlank()) {
            version = "1.0.0";
        }
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (deploymentVersion == null || deploymentVersion.isBlank()) {
            deploymentVersion = "blue";
        }
    }
}
