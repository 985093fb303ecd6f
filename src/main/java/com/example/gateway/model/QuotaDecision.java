package com.example.gateway.model;

/**
 * High-level outcome of a single quota evaluation.
 */
public enum QuotaDecision {
    /**
     * Request is within the effective limit of its window and may proceed.
     */
    ALLOW,

    /**
     * Request would push the window past its effective limit.
     */
    REJECT_QUOTA_EXCEEDED,

    /**
     * Counter store unavailable and the rule is not eligible for fail-open.
     */
    REJECT_STORE_FAILURE
}
