package com.kubelab.api.api;

import com.kubelab.api.config.SimulationProperties;
import com.kubelab.api.infrastructure.async.LatencySimulator;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

/**
 * Scrape target and log/trace generators for observability stacks.
 */
@RestController
public class ObservabilityController {

    private static final Logger log = LoggerFactory.getLogger(ObservabilityController.class);

    static final int SPAN_COUNT = 3;

    private final PrometheusMeterRegistry registry;
    private final LatencySimulator latency;
    private final SimulationProperties simulation;
    private final Clock clock;

    public ObservabilityController(
            PrometheusMeterRegistry registry,
            LatencySimulator latency,
            SimulationProperties simulation,
            Clock clock) {
        this.registry = registry;
        this.latency = latency;
        this.simulation = simulation;
        this.clock = clock;
    }

    /** Prometheus text exposition (format 0.0.4) of the registry at the instant of the call. */
    @GetMapping("/metrics")
    public ResponseEntity<String> metrics() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004)
                .body(registry.scrape());
    }

    @GetMapping("/observability/logs")
    public Map<String, Object> logs() {
        log.info("Info log generated via API");
        log.warn("Warning log generated via API");
        log.error("Error log generated via API");

        return Map.of(
                "message", "Test logs generated",
                "levels", List.of("info", "warning", "error"),
                "timestamp", clock.instant().toString());
    }

    /**
     * Walks through the configured span delays and returns a fabricated trace ID. Nothing is
     * exported to a tracing backend.
     */
    @GetMapping("/observability/trace")
    public DeferredResult<Map<String, Object>> trace() {
        return latency.after(simulation.traceDelays(), () -> {
            var now = clock.instant();
            return Map.of(
                    "message", "Trace endpoint completed",
                    "trace_id", "trace-" + now.toEpochMilli(),
                    "span_count", SPAN_COUNT,
                    "timestamp", now.toString());
        });
    }
}
