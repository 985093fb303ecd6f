package com.example.gateway.model;

import java.time.Instant;

/**
 * Result returned by the quota ledger for a single check-and-consume.
 */
public class QuotaResult {

    private final QuotaDecision decision;
    private final long remaining;
    private final Instant resetAt;
    private final boolean degraded;

    public QuotaResult(QuotaDecision decision, long remaining, Instant resetAt, boolean degraded) {
        this.decision = decision;
        this.remaining = remaining;
        this.resetAt = resetAt;
        this.degraded = degraded;
    }

    public static QuotaResult allow(long remaining, Instant resetAt) {
        return new QuotaResult(QuotaDecision.ALLOW, remaining, resetAt, false);
    }

    public static QuotaResult rejectQuotaExceeded(long remaining, Instant resetAt) {
        return new QuotaResult(QuotaDecision.REJECT_QUOTA_EXCEEDED, remaining, resetAt, false);
    }

    /**
     * Allowed without enforcement because the counter store could not be reached.
     */
    public static QuotaResult failOpen(Instant resetAt) {
        return new QuotaResult(QuotaDecision.ALLOW, -1L, resetAt, true);
    }

    public static QuotaResult rejectStoreFailure(Instant resetAt) {
        return new QuotaResult(QuotaDecision.REJECT_STORE_FAILURE, 0L, resetAt, true);
    }

    public QuotaDecision getDecision() {
        return decision;
    }

    public boolean isAllowed() {
        return decision == QuotaDecision.ALLOW;
    }

    /**
     * @return units left in the current window, or -1 when the result was produced without enforcement
     */
    public long getRemaining() {
        return remaining;
    }

    public Instant getResetAt() {
        return resetAt;
    }

    /**
     * @return true if the result was produced while the counter store was unavailable
     */
    public boolean isDegraded() {
        return degraded;
    }
}
