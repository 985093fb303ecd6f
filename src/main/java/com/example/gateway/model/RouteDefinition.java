package com.example.gateway.model;

import java.util.List;
import java.util.Objects;

/**
 * Candidate upstreams, and an optional fallback, serving every resource matching a pattern.
 */
public final class RouteDefinition {

    private final String resourcePattern;
    private final List<String> upstreams;
    private final String fallback;
    private final List<String> emergencyUpstreams;

    public RouteDefinition(String resourcePattern, List<String> upstreams, String fallback) {
        this(resourcePattern, upstreams, fallback, List.of());
    }

    public RouteDefinition(String resourcePattern, List<String> upstreams, String fallback, List<String> emergencyUpstreams) {
        this.resourcePattern = Objects.requireNonNull(resourcePattern, "resourcePattern");
        this.upstreams = List.copyOf(upstreams);
        this.fallback = fallback;
        this.emergencyUpstreams = emergencyUpstreams != null ? List.copyOf(emergencyUpstreams) : List.of();
    }

    public String getResourcePattern() {
        return resourcePattern;
    }

    public List<String> getUpstreams() {
        return upstreams;
    }

    /**
     * @return the upstream used, degraded, when no candidate survives, or null
     */
    public String getFallback() {
        return fallback;
    }

    /**
     * @return upstreams reserved for emergency classes, tried before {@link #getUpstreams()}
     */
    public List<String> getEmergencyUpstreams() {
        return emergencyUpstreams;
    }

    @Override
    public String toString() {
        return "RouteDefinition[" + resourcePattern + " -> " + upstreams
                + (emergencyUpstreams.isEmpty() ? "" : ", emergency " + emergencyUpstreams)
                + (fallback != null ? ", fallback " + fallback : "") + "]";
    }
}
