package com.example.gateway.config;

import com.example.gateway.health.AdaptiveProbeTrigger;
import com.example.gateway.health.HealthMonitor;
import com.example.gateway.health.HealthProber;
import com.example.gateway.service.RoutingEngine;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Clock;
import java.time.Duration;

/**
 * Registers the background work whose cadence comes from {@link GatewayProperties}: sample
 * aggregation, adaptive health probing and lease reclamation.
 */
@Configuration
public class GatewaySchedulingConfig implements SchedulingConfigurer {

    private static final Duration LEASE_SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final GatewayProperties properties;
    private final HealthMonitor healthMonitor;
    private final HealthProber healthProber;
    private final RoutingEngine routingEngine;
    private final Clock clock;

    public GatewaySchedulingConfig(
            GatewayProperties properties,
            HealthMonitor healthMonitor,
            HealthProber healthProber,
            RoutingEngine routingEngine,
            Clock clock
    ) {
        this.properties = properties;
        this.healthMonitor = healthMonitor;
        this.healthProber = healthProber;
        this.routingEngine = routingEngine;
        this.clock = clock;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addFixedDelayTask(healthMonitor::aggregate, properties.getHealth().getAggregationInterval());
        registrar.addTriggerTask(healthProber::probeAll, new AdaptiveProbeTrigger(properties, clock));
        registrar.addFixedDelayTask(routingEngine::reclaimExpiredLeases, LEASE_SWEEP_INTERVAL);
    }
}
