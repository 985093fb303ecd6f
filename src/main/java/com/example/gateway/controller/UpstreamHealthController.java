package com.example.gateway.controller;

import com.example.gateway.health.CircuitBreaker;
import com.example.gateway.health.HealthMonitor;
import com.example.gateway.model.UpstreamService;
import com.example.gateway.model.UpstreamStatus;
import com.example.gateway.service.RoutingEngine;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
public class UpstreamHealthController {

    private final HealthMonitor healthMonitor;
    private final RoutingEngine routingEngine;

    public UpstreamHealthController(HealthMonitor healthMonitor, RoutingEngine routingEngine) {
        this.healthMonitor = healthMonitor;
        this.routingEngine = routingEngine;
    }

    @GetMapping("/api/admin/upstreams")
    public List<UpstreamStatus> upstreams() {
        return healthMonitor.breakers().stream()
                .map(this::toStatus)
                .collect(Collectors.toList());
    }

    private UpstreamStatus toStatus(CircuitBreaker breaker) {
        UpstreamService upstream = breaker.getUpstream();
        double latency = breaker.getLatencyMs();
        return new UpstreamStatus(
                upstream.getId(),
                breaker.getState(),
                upstream.isCriticalPath(),
                Double.isNaN(latency) ? null : latency,
                healthMonitor.failureRatioOf(upstream.getId()),
                routingEngine.inFlight(upstream.getId()),
                upstream.getMaxConcurrency(),
                routingEngine.reservedSlots(upstream));
    }
}
