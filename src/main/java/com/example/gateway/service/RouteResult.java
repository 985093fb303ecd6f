package com.example.gateway.service;

/**
 * Outcome of routing one admitted request: a target with its lease, or a rejection.
 */
public final class RouteResult {

    public static final String NO_HEALTHY_UPSTREAM = "no_healthy_upstream";
    public static final String UPSTREAMS_SATURATED = "upstreams_saturated";

    private final UpstreamLease lease;
    private final boolean degraded;
    private final String rejection;

    private RouteResult(UpstreamLease lease, boolean degraded, String rejection) {
        this.lease = lease;
        this.degraded = degraded;
        this.rejection = rejection;
    }

    static RouteResult routed(UpstreamLease lease, boolean degraded) {
        return new RouteResult(lease, degraded, null);
    }

    static RouteResult rejected(String rejection) {
        return new RouteResult(null, false, rejection);
    }

    public boolean isRouted() {
        return lease != null;
    }

    public String getTarget() {
        return lease != null ? lease.getUpstreamId() : null;
    }

    public UpstreamLease getLease() {
        return lease;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public String getRejection() {
        return rejection;
    }
}
