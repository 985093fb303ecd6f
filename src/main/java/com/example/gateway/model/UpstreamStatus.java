package com.example.gateway.model;

/**
 * Point-in-time view of one upstream for operators.
 */
public class UpstreamStatus {

    private final String id;
    private final CircuitState state;
    private final boolean criticalPath;
    private final Double latencyMs;
    private final double failureRatio;
    private final int inFlight;
    private final int maxConcurrency;
    private final int reservedSlots;

    public UpstreamStatus(
            String id,
            CircuitState state,
            boolean criticalPath,
            Double latencyMs,
            double failureRatio,
            int inFlight,
            int maxConcurrency,
            int reservedSlots
    ) {
        this.id = id;
        this.state = state;
        this.criticalPath = criticalPath;
        this.latencyMs = latencyMs;
        this.failureRatio = failureRatio;
        this.inFlight = inFlight;
        this.maxConcurrency = maxConcurrency;
        this.reservedSlots = reservedSlots;
    }

    public String getId() {
        return id;
    }

    public CircuitState getState() {
        return state;
    }

    public boolean isCriticalPath() {
        return criticalPath;
    }

    /**
     * @return smoothed latency, or null before the first successful sample
     */
    public Double getLatencyMs() {
        return latencyMs;
    }

    public double getFailureRatio() {
        return failureRatio;
    }

    public int getInFlight() {
        return inFlight;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public int getReservedSlots() {
        return reservedSlots;
    }
}
