package com.example.gateway.telemetry;

/**
 * How the gateway behaved when a backing store could not be reached.
 */
public enum FailMode {
    /**
     * Traffic was let through without enforcement.
     */
    OPEN,

    /**
     * Traffic was refused to keep enforcement guarantees.
     */
    CLOSED
}
