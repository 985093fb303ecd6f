package com.example.gateway.model;

/**
 * Full result of classifying one request: the priority class plus the quota adjustments it earns.
 */
public final class Classification {

    private final PriorityClass priorityClass;
    private final boolean eventDay;
    private final double overrideMultiplier;

    public Classification(PriorityClass priorityClass, boolean eventDay, double overrideMultiplier) {
        this.priorityClass = priorityClass;
        this.eventDay = eventDay;
        this.overrideMultiplier = overrideMultiplier;
    }

    public PriorityClass getPriorityClass() {
        return priorityClass;
    }

    /**
     * @return true if the request was verified as belonging to an event happening today
     */
    public boolean isEventDay() {
        return eventDay;
    }

    /**
     * Largest quota multiplier granted by an active override, 1 when none applies.
     */
    public double getOverrideMultiplier() {
        return overrideMultiplier;
    }

    /**
     * Multiplier to apply to {@code rule}'s base quota for this request.
     */
    public double quotaMultiplierFor(RateLimitRule rule) {
        double boost = eventDay ? rule.getPriorityMultiplier() : 1.0;
        return boost * overrideMultiplier;
    }
}
