package com.kubelab.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for creating Micrometer meters against an injected registry.
 * <p>
 * The registry is passed in rather than looked up globally so that tests can run against an isolated
 * {@code SimpleMeterRegistry} and the application can hand the same instance to the
 * exposition endpoint.
 * <p>
 * Micrometer caches meters by name and tags, so asking for the same counter twice returns
 * the already registered instance.
 */
public final class MetricFactory {

    private final MeterRegistry registry;

    /**
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     */
    public MetricFactory(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Returns the counter for the given name and tags, registering it on first use.
     *
     * @param name        metric name (e.g., "http.requests")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags)
                .register(registry);
    }

    /**
     * Creates a timer that publishes a cumulative histogram with fixed bucket boundaries.
     *
     * @param name        metric name (e.g., "http.request.duration")
     * @param description human-readable description
     * @param buckets     histogram bucket upper bounds
     * @param tags        additional tags (key-value pairs)
     * @return the timer
     */
    public Timer histogramTimer(String name, String description, Duration[] buckets, String... tags) {
        if (buckets == null || buckets.length == 0) {
            throw new IllegalArgumentException("buckets must not be empty");
        }
        return Timer.builder(name)
                .description(description)
                .serviceLevelObjectives(buckets)
                .tags(tags)
                .register(registry);
    }

    /**
     * Registers a gauge backed by an {@link AtomicLong}.
     * <p>
     * Micrometer only keeps a weak reference to the gauge state, so callers must hold on to
     * the returned value for as long as the gauge should report.
     *
     * @param name        metric name (e.g., "active.connections")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return an AtomicLong that can be used to update the gauge value
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(tags)
                .register(registry);
        return value;
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }
}
