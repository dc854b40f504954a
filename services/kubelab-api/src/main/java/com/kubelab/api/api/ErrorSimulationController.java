package com.kubelab.api.api;

import com.kubelab.api.config.SimulationProperties;
import com.kubelab.api.infrastructure.async.LatencySimulator;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;
import org.springframework.web.server.ResponseStatusException;

/** Error injection for probes, retries and alerting rules. */
@RestController
@RequestMapping("/error")
public class ErrorSimulationController {

    static final String INTERNAL_ERROR_DETAIL = "Internal Server Error - Test endpoint";
    static final String NOT_FOUND_DETAIL = "Not Found - Test endpoint";

    private final LatencySimulator latency;
    private final SimulationProperties simulation;

    public ErrorSimulationController(LatencySimulator latency, SimulationProperties simulation) {
        this.latency = latency;
        this.simulation = simulation;
    }

    @GetMapping("/500")
    public Map<String, Object> internalServerError() {
        throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_DETAIL);
    }

    @GetMapping("/404")
    public Map<String, Object> notFound() {
        throw new ResponseStatusException(HttpStatus.NOT_FOUND, NOT_FOUND_DETAIL);
    }

    /** Holds the request for the configured delay, long enough to trip ingress timeouts. */
    @GetMapping("/timeout")
    public DeferredResult<Map<String, Object>> timeout() {
        return latency.after(simulation.timeoutDelay(), () -> Map.of("message", "This should timeout"));
    }
}
