package com.example.gateway.store;

/**
 * Outcome of one atomic check-and-consume against a counter.
 */
public final class CounterResult {

    private final boolean allowed;
    private final long count;

    public CounterResult(boolean allowed, long count) {
        this.allowed = allowed;
        this.count = count;
    }

    public boolean isAllowed() {
        return allowed;
    }

    /**
     * Counter value after the call. Unchanged when the consume was refused.
     */
    public long getCount() {
        return count;
    }
}
