package com.example.gateway.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Operator input for creating an emergency override.
 */
public class OverrideRequest {

    @NotNull
    private OverrideScope scope;

    /**
     * Principal id or event id, depending on the scope. Ignored for global overrides.
     */
    private String target;

    @NotNull
    private OverrideEffect effect;

    private Double factor;

    private PriorityClass priorityClass;

    @NotNull
    private Instant expiresAt;

    @NotBlank
    private String issuedBy;

    private String reason;

    public OverrideScope getScope() {
        return scope;
    }

    public void setScope(OverrideScope scope) {
        this.scope = scope;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public OverrideEffect getEffect() {
        return effect;
    }

    public void setEffect(OverrideEffect effect) {
        this.effect = effect;
    }

    public Double getFactor() {
        return factor;
    }

    public void setFactor(Double factor) {
        this.factor = factor;
    }

    public PriorityClass getPriorityClass() {
        return priorityClass;
    }

    public void setPriorityClass(PriorityClass priorityClass) {
        this.priorityClass = priorityClass;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public String getIssuedBy() {
        return issuedBy;
    }

    public void setIssuedBy(String issuedBy) {
        this.issuedBy = issuedBy;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
