package com.example.gateway.telemetry;

import com.example.gateway.model.CircuitState;

import java.time.Instant;

/**
 * Published on every circuit state change of an upstream.
 */
public final class CircuitTransitionEvent {

    private final String upstreamId;
    private final CircuitState from;
    private final CircuitState to;
    private final Instant at;
    private final String cause;

    public CircuitTransitionEvent(String upstreamId, CircuitState from, CircuitState to, Instant at, String cause) {
        this.upstreamId = upstreamId;
        this.from = from;
        this.to = to;
        this.at = at;
        this.cause = cause;
    }

    public String getUpstreamId() {
        return upstreamId;
    }

    public CircuitState getFrom() {
        return from;
    }

    public CircuitState getTo() {
        return to;
    }

    public Instant getAt() {
        return at;
    }

    public String getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "CircuitTransitionEvent[" + upstreamId + " " + from + " -> " + to + " at " + at + ": " + cause + "]";
    }
}
