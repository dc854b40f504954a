package com.kubelab.api.api;

import com.kubelab.api.config.SimulationProperties;
import com.kubelab.api.infrastructure.async.LatencySimulator;
import com.kubelab.api.infrastructure.system.SystemStatsProvider;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

/**
 * Targets for load-balancer and autoscaling tests.
 *
 * <p>Every response names the replica that served it as {@code instance_id}.
 */
@RestController
@RequestMapping("/load-test")
public class LoadTestController {

    static final int CPU_ITERATIONS = 1_000_000;

    private final SystemStatsProvider stats;
    private final LatencySimulator latency;
    private final SimulationProperties simulation;
    private final Clock clock;

    public LoadTestController(
            SystemStatsProvider stats,
            LatencySimulator latency,
            SimulationProperties simulation,
            Clock clock) {
        this.stats = stats;
        this.latency = latency;
        this.simulation = simulation;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        return Map.of(
                "instance_id", stats.instanceId(),
                "hostname", stats.hostname(),
                "cpu_percent", stats.cpuPercent(),
                "memory_percent", stats.memory().percent(),
                "timestamp", clock.instant().toString());
    }

    /** Busy loop summing {@code i * i} for {@code i < 1_000_000} on the request thread. */
    @GetMapping("/cpu")
    public Map<String, Object> cpu() {
        long start = System.nanoTime();
        long result = 0;
        for (long i = 0; i < CPU_ITERATIONS; i++) {
            result += i * i;
        }
        double duration = (System.nanoTime() - start) / 1e9;

        return Map.of(
                "message", "CPU intensive task completed",
                "duration", duration,
                "result", result,
                "instance_id", stats.instanceId(),
                "timestamp", clock.instant().toString());
    }

    @GetMapping("/memory")
    public Map<String, Object> memory() {
        var snapshot = stats.memory();
        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("total", snapshot.total());
        memory.put("available", snapshot.available());
        memory.put("percent", snapshot.percent());
        memory.put("used", snapshot.used());
        memory.put("free", snapshot.free());

        return Map.of(
                "memory", memory,
                "instance_id", stats.instanceId(),
                "timestamp", clock.instant().toString());
    }

    /** Answers after the configured delay without blocking a request thread. */
    @GetMapping("/async")
    public DeferredResult<Map<String, Object>> async() {
        long start = System.nanoTime();
        return latency.after(simulation.asyncDelay(), () -> Map.of(
                "message", "Async task completed",
                "duration", (System.nanoTime() - start) / 1e9,
                "instance_id", stats.instanceId(),
                "timestamp", clock.instant().toString()));
    }
}
