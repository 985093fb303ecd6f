package com.example.gateway.health;

import java.time.Instant;

/**
 * One observation of an upstream, either from an active probe or from a real request's outcome.
 */
public final class HealthSample {

    public enum Source {
        PROBE,
        REQUEST
    }

    private final String upstreamId;
    private final boolean success;
    private final long latencyMs;
    private final Instant at;
    private final Source source;
    private final boolean probeLease;

    public HealthSample(String upstreamId, boolean success, long latencyMs, Instant at, Source source) {
        this(upstreamId, success, latencyMs, at, source, false);
    }

    public HealthSample(String upstreamId, boolean success, long latencyMs, Instant at, Source source, boolean probeLease) {
        this.upstreamId = upstreamId;
        this.success = success;
        this.latencyMs = latencyMs;
        this.at = at;
        this.source = source;
        this.probeLease = probeLease;
    }

    public String getUpstreamId() {
        return upstreamId;
    }

    public boolean isSuccess() {
        return success;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public Instant getAt() {
        return at;
    }

    public Source getSource() {
        return source;
    }

    /**
     * @return true if a request sample came from a lease holding a half-open probe permit
     */
    public boolean isProbeLease() {
        return probeLease;
    }
}
