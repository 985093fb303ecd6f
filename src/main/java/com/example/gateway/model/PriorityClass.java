package com.example.gateway.model;

/**
 * Scheduling preference attached to a request at classification time, lowest first.
 */
public enum PriorityClass {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(PriorityClass other) {
        return compareTo(other) >= 0;
    }

    public static PriorityClass max(PriorityClass a, PriorityClass b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static PriorityClass min(PriorityClass a, PriorityClass b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
