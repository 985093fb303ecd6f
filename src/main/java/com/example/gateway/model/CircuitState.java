package com.example.gateway.model;

/**
 * Breaker state of one upstream, owned by the health monitor.
 */
public enum CircuitState {
    /**
     * Healthy, all traffic flows.
     */
    CLOSED,

    /**
     * Unhealthy. Traffic is redirected, or reduced to a trickle for critical-path upstreams.
     */
    OPEN,

    /**
     * Recovery is being probed with a limited number of requests.
     */
    HALF_OPEN
}
