package com.example.gateway.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A quota applying to every resource matching {@link #getResourcePattern()}, owned by one principal
 * or by a tier template.
 */
public final class RateLimitRule {

    private final String name;
    private final String resourcePattern;
    private final long baseQuota;
    private final Duration window;
    private final double priorityMultiplier;
    private final boolean criticalPath;

    public RateLimitRule(
            String name,
            String resourcePattern,
            long baseQuota,
            Duration window,
            double priorityMultiplier,
            boolean criticalPath
    ) {
        if (baseQuota <= 0) {
            throw new IllegalArgumentException("baseQuota must be > 0 for rule " + name);
        }
        if (window == null || window.toMillis() < 1000) {
            throw new IllegalArgumentException("window must be at least one second for rule " + name);
        }
        if (!(priorityMultiplier >= 1.0) || Double.isInfinite(priorityMultiplier)) {
            throw new IllegalArgumentException("priorityMultiplier must be >= 1 for rule " + name);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.resourcePattern = Objects.requireNonNull(resourcePattern, "resourcePattern");
        this.baseQuota = baseQuota;
        this.window = window;
        this.priorityMultiplier = priorityMultiplier;
        this.criticalPath = criticalPath;
    }

    public String getName() {
        return name;
    }

    public String getResourcePattern() {
        return resourcePattern;
    }

    public long getBaseQuota() {
        return baseQuota;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Factor applied to the base quota while an event-day boost is active.
     */
    public double getPriorityMultiplier() {
        return priorityMultiplier;
    }

    /**
     * @return true if event-bound traffic under this rule may proceed when the counter store is down
     */
    public boolean isCriticalPath() {
        return criticalPath;
    }

    /**
     * Effective limit for the given multiplier, never below the base quota.
     */
    public long effectiveLimit(double multiplier) {
        double scaled = Math.floor(baseQuota * Math.max(1.0, multiplier));
        return scaled >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) scaled;
    }

    @Override
    public String toString() {
        return "RateLimitRule[" + name + ", " + baseQuota + "/" + window + "]";
    }
}
