package com.kubelab.api.config;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/** Clock and the scheduler that completes delayed responses. */
@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService latencyScheduler(SimulationProperties properties) {
        var threadFactory = new CustomizableThreadFactory("latency-sim-");
        threadFactory.setDaemon(true);
        return Executors.newScheduledThreadPool(properties.schedulerThreads(), threadFactory);
    }
}
