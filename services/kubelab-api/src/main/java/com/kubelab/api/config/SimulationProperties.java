package com.kubelab.api.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Artificial delays served by the load-test, trace and timeout endpoints, bound from
 * {@code kubelab.simulation.*}.
 *
 * @param asyncDelay delay of {@code /load-test/async}.
 * @param traceDelays sequential delays of {@code /observability/trace}, one per simulated span.
 * @param timeoutDelay delay of {@code /error/timeout}.
 * @param schedulerThreads threads of the scheduler completing delayed responses.
 */
@ConfigurationProperties(prefix = "kubelab.simulation")
@Validated
public record SimulationProperties(
        Duration asyncDelay,
        List<Duration> traceDelays,
        Duration timeoutDelay,
        @Min(1) int schedulerThreads) {

    public SimulationProperties {
        if (asyncDelay == null) {
            asyncDelay = Duration.ofMillis(100);
        }
        if (traceDelays == null || traceDelays.isEmpty()) {
            traceDelays = List.of(Duration.ofMillis(50), Duration.ofMillis(20));
        } else {
            traceDelays = List.copyOf(traceDelays);
        }
        if (timeoutDelay == null) {
            timeoutDelay = Duration.ofSeconds(30);
        }
        if (schedulerThreads <= 0) {
            schedulerThreads = 2;
        }
    }
}
