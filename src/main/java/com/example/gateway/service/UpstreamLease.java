package com.example.gateway.service;

import java.time.Instant;

/**
 * An in-flight slot held on one upstream until the caller reports the request's outcome.
 */
public final class UpstreamLease {

    private final String id;
    private final String upstreamId;
    private final Instant acquiredAt;
    private final boolean probe;

    UpstreamLease(String id, String upstreamId, Instant acquiredAt, boolean probe) {
        this.id = id;
        this.upstreamId = upstreamId;
        this.acquiredAt = acquiredAt;
        this.probe = probe;
    }

    public String getId() {
        return id;
    }

    public String getUpstreamId() {
        return upstreamId;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    /**
     * @return true if the slot also holds one of a half-open upstream's probe permits
     */
    public boolean isProbe() {
        return probe;
    }
}
