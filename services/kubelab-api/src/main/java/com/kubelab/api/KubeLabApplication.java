package com.kubelab.api;

import com.kubelab.api.config.CorsProperties;
import com.kubelab.api.config.KubeLabProperties;
import com.kubelab.api.config.SecurityProperties;
import com.kubelab.api.config.SimulationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * KubeLab API, a small HTTP service for exercising Kubernetes features.
 *
 * <p>Every endpoint returns a canned or trivially computed payload. What the service offers the
 * cluster is the surface around them:
 *
 * <ul>
 *   <li>liveness and readiness probes ({@code /health}, {@code /actuator/health/*})
 *   <li>blue/green routing targets ({@code /deployment/*})
 *   <li>Prometheus scraping ({@code /metrics})
 *   <li>a bcrypt/JWT login flow ({@code /auth/*})
 *   <li>load and error injection ({@code /load-test/*}, {@code /error/*})
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({
    KubeLabProperties.class,
    SecurityProperties.class,
    SimulationProperties.class,
    CorsProperties.class
})
public class KubeLabApplication {

    private static final Logger log = LoggerFactory.getLogger(KubeLabApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(KubeLabApplication.class, args);
        log.info("KubeLab API started successfully");
    }
}
