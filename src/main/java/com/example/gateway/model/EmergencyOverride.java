package com.example.gateway.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A time-bounded, operator-issued adjustment of quotas or priority.
 * <p>
 * Overrides are immutable. They become inert once {@link #getExpiresAt()} has passed, and an
 * extension is a new override rather than a change to this one.
 */
public final class EmergencyOverride {

    private final String id;
    private final OverrideScope scope;
    private final String target;
    private final OverrideEffect effect;
    private final Double factor;
    private final PriorityClass priorityClass;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final String issuedBy;
    private final String reason;

    public EmergencyOverride(
            String id,
            OverrideScope scope,
            String target,
            OverrideEffect effect,
            Double factor,
            PriorityClass priorityClass,
            Instant createdAt,
            Instant expiresAt,
            String issuedBy,
            String reason
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.target = target;
        this.effect = Objects.requireNonNull(effect, "effect");
        this.factor = factor;
        this.priorityClass = priorityClass;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        this.issuedBy = Objects.requireNonNull(issuedBy, "issuedBy");
        this.reason = reason;
    }

    public boolean isActiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    public boolean appliesTo(String principalId, String eventId) {
        switch (scope) {
            case GLOBAL:
                return true;
            case PRINCIPAL:
                return target.equals(principalId);
            case EVENT:
                return eventId != null && target.equals(eventId);
            default:
                return false;
        }
    }

    /**
     * Copy of this override that expired at {@code at}.
     */
    public EmergencyOverride expiredAt(Instant at) {
        return new EmergencyOverride(id, scope, target, effect, factor, priorityClass, createdAt, at, issuedBy, reason);
    }

    public String getId() {
        return id;
    }

    public OverrideScope getScope() {
        return scope;
    }

    public String getTarget() {
        return target;
    }

    public OverrideEffect getEffect() {
        return effect;
    }

    public Double getFactor() {
        return factor;
    }

    public PriorityClass getPriorityClass() {
        return priorityClass;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public String getIssuedBy() {
        return issuedBy;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "EmergencyOverride[" + id + ", " + scope + (target != null ? ":" + target : "")
                + ", " + effect + ", until " + expiresAt + ", by " + issuedBy + "]";
    }
}
