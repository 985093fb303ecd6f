package com.example.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structured reason carried by a denied admission decision.
 */
public enum DenialReason {
    QUOTA_EXCEEDED("QuotaExceeded"),
    UPSTREAM_UNAVAILABLE("UpstreamUnavailable"),
    CONFIGURATION_MISSING("ConfigurationMissing"),
    STORE_UNAVAILABLE("StoreUnavailable"),
    UNKNOWN_PRINCIPAL("UnknownPrincipal"),
    INTERNAL_ERROR("InternalError");

    private final String wireName;

    DenialReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
