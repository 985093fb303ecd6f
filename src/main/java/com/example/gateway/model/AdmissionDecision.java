package com.example.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Output of one orchestrator invocation. Callers never see internal error types, only this shape.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdmissionDecision {

    private final boolean allowed;
    private final PriorityClass priorityClass;
    private final String upstreamTarget;
    private final Boolean degraded;
    private final DenialReason reason;
    private final String detail;
    private final Long retryAfterSeconds;
    private final String leaseId;
    private final Long remainingQuota;
    private final Instant resetAt;

    private AdmissionDecision(
            boolean allowed,
            PriorityClass priorityClass,
            String upstreamTarget,
            Boolean degraded,
            DenialReason reason,
            String detail,
            Long retryAfterSeconds,
            String leaseId,
            Long remainingQuota,
            Instant resetAt
    ) {
        this.allowed = allowed;
        this.priorityClass = priorityClass;
        this.upstreamTarget = upstreamTarget;
        this.degraded = degraded;
        this.reason = reason;
        this.detail = detail;
        this.retryAfterSeconds = retryAfterSeconds;
        this.leaseId = leaseId;
        this.remainingQuota = remainingQuota;
        this.resetAt = resetAt;
    }

    public static AdmissionDecision allow(PriorityClass priorityClass, String upstreamTarget, boolean degraded, String leaseId) {
        return new AdmissionDecision(true, priorityClass, upstreamTarget, degraded, null, null, null, leaseId, null, null);
    }

    public static AdmissionDecision deny(PriorityClass priorityClass, DenialReason reason, String detail) {
        return new AdmissionDecision(false, priorityClass, null, null, reason, detail, null, null, null, null);
    }

    public static AdmissionDecision deny(PriorityClass priorityClass, DenialReason reason, String detail, long retryAfterSeconds) {
        return new AdmissionDecision(false, priorityClass, null, null, reason, detail, retryAfterSeconds, null, null, null);
    }

    /**
     * Copy of this decision carrying the quota window the request was counted in. A remaining
     * count is only reported when the counter store actually answered.
     */
    public AdmissionDecision withQuota(QuotaResult quota) {
        Long remaining = quota.getRemaining() >= 0 ? quota.getRemaining() : null;
        return new AdmissionDecision(allowed, priorityClass, upstreamTarget, degraded, reason, detail,
                retryAfterSeconds, leaseId, remaining, quota.getResetAt());
    }

    public boolean isAllowed() {
        return allowed;
    }

    public PriorityClass getPriorityClass() {
        return priorityClass;
    }

    public String getUpstreamTarget() {
        return upstreamTarget;
    }

    public Boolean getDegraded() {
        return degraded;
    }

    public boolean isDegraded() {
        return Boolean.TRUE.equals(degraded);
    }

    public DenialReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public String getLeaseId() {
        return leaseId;
    }

    public Long getRemainingQuota() {
        return remainingQuota;
    }

    public Instant getResetAt() {
        return resetAt;
    }

    @Override
    public String toString() {
        if (allowed) {
            return "AdmissionDecision[allowed, " + priorityClass + " -> " + upstreamTarget
                    + (isDegraded() ? " (degraded)" : "") + "]";
        }
        return "AdmissionDecision[denied, " + priorityClass + ", " + reason + ": " + detail + "]";
    }
}
