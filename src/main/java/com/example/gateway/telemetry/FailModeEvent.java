package com.example.gateway.telemetry;

import java.time.Instant;

/**
 * Published whenever a request was let through or refused without enforcement, because the counter
 * store was unavailable or admission itself failed.
 */
public final class FailModeEvent {

    private final String principalId;
    private final String ruleName;
    private final FailMode mode;
    private final Instant at;
    private final String cause;

    public FailModeEvent(String principalId, String ruleName, FailMode mode, Instant at, String cause) {
        this.principalId = principalId;
        this.ruleName = ruleName;
        this.mode = mode;
        this.at = at;
        this.cause = cause;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public FailMode getMode() {
        return mode;
    }

    public Instant getAt() {
        return at;
    }

    public String getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "FailModeEvent[" + mode + " " + principalId + " / " + ruleName + " at " + at + ": " + cause + "]";
    }
}
