package com.kubelab.api.config;

import com.kubelab.observability.HttpRequestMetrics;
import com.kubelab.observability.MetricFactory;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Request metrics wiring.
 *
 * <p>The service owns its {@link PrometheusMeterRegistry}, so {@code /metrics} serves the same
 * registry in every profile, tests included. Spring Boot binds its JVM and process meters to it
 * as well.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public PrometheusMeterRegistry prometheusMeterRegistry() {
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    @Bean
    public MetricFactory metricFactory(PrometheusMeterRegistry registry) {
        return new MetricFactory(registry);
    }

    @Bean
    public HttpRequestMetrics httpRequestMetrics(MetricFactory metricFactory) {
        return new HttpRequestMetrics(metricFactory);
    }
}
