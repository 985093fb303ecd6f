package com.example.gateway.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A named backend dependency such as the payment processor or the email sender.
 */
public final class UpstreamService {

    private final String id;
    private final double failureThreshold;
    private final Duration recoveryTimeout;
    private final boolean criticalPath;
    private final int maxConcurrency;
    private final String healthUrl;
    private final int minimumSamples;

    public UpstreamService(
            String id,
            double failureThreshold,
            Duration recoveryTimeout,
            boolean criticalPath,
            int maxConcurrency,
            String healthUrl,
            int minimumSamples
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        this.criticalPath = criticalPath;
        this.maxConcurrency = maxConcurrency;
        this.healthUrl = healthUrl;
        this.minimumSamples = minimumSamples;
    }

    public String getId() {
        return id;
    }

    /**
     * Failure ratio in the rolling window above which the circuit opens.
     */
    public double getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    /**
     * Critical-path upstreams are never fully circuit-broken, only degraded to a trickle.
     */
    public boolean isCriticalPath() {
        return criticalPath;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * @return the URL actively probed by the monitor, or null for passive sampling only
     */
    public String getHealthUrl() {
        return healthUrl;
    }

    public int getMinimumSamples() {
        return minimumSamples;
    }

    @Override
    public String toString() {
        return "UpstreamService[" + id + (criticalPath ? ", critical-path" : "") + "]";
    }
}
