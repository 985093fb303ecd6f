package com.example.gateway.health;

import com.example.gateway.model.CircuitState;
import com.example.gateway.model.UpstreamService;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Breaker state machine of one upstream.
 *
 * <pre>
 * CLOSED
 *   │ failure ratio in the rolling window above threshold
 *   ▼
 * OPEN
 *   │ recovery timeout elapsed
 *   ▼
 * HALF_OPEN ──► enough consecutive successes ──► CLOSED
 *   └─────────► any failure ──────────────────► OPEN
 * </pre>
 *
 * State changes only happen through {@link #record} and {@link #evaluateTimers}, which the health
 * monitor calls from its aggregation thread. The state and latency fields are volatile so the
 * routing path can read them without locking.
 */
public final class CircuitBreaker {

    private final UpstreamService upstream;
    private final RollingWindow window;
    private final int halfOpenProbes;
    private final double latencySmoothing;

    private final AtomicInteger outstandingProbes = new AtomicInteger();

    private volatile CircuitState state = CircuitState.CLOSED;
    private volatile long openedAtMillis;
    private volatile double latencyMs = Double.NaN;
    private int consecutiveProbeSuccesses;

    public CircuitBreaker(UpstreamService upstream, int rollingWindowSeconds, int halfOpenProbes, double latencySmoothing) {
        this.upstream = upstream;
        this.window = new RollingWindow(rollingWindowSeconds);
        this.halfOpenProbes = halfOpenProbes;
        this.latencySmoothing = latencySmoothing;
    }

    /**
     * Applies one sample and returns the transition it caused, if any.
     */
    synchronized Optional<Transition> record(HealthSample sample, Instant now) {
        if (sample.isSuccess()) {
            double previous = latencyMs;
            latencyMs = Double.isNaN(previous)
                    ? sample.getLatencyMs()
                    : latencySmoothing * sample.getLatencyMs() + (1.0 - latencySmoothing) * previous;
        }

        switch (state) {
            case CLOSED:
                window.record(sample.getAt().toEpochMilli(), sample.isSuccess());
                long nowMillis = now.toEpochMilli();
                int total = window.total(nowMillis);
                double ratio = window.failureRatio(nowMillis);
                if (total >= upstream.getMinimumSamples() && ratio > upstream.getFailureThreshold()) {
                    return Optional.of(open(now, String.format("failure ratio %.2f over %d samples exceeds %.2f",
                            ratio, total, upstream.getFailureThreshold())));
                }
                return Optional.empty();
            case HALF_OPEN:
                if (sample.getSource() == HealthSample.Source.REQUEST) {
                    if (!sample.isProbeLease()) {
                        // Not admitted on a probe permit, so it says nothing about recovery.
                        return Optional.empty();
                    }
                    outstandingProbes.updateAndGet(n -> Math.max(0, n - 1));
                }
                if (!sample.isSuccess()) {
                    return Optional.of(open(now, "probe failed while half-open"));
                }
                consecutiveProbeSuccesses++;
                if (consecutiveProbeSuccesses >= halfOpenProbes) {
                    window.reset();
                    outstandingProbes.set(0);
                    state = CircuitState.CLOSED;
                    return Optional.of(new Transition(CircuitState.HALF_OPEN, CircuitState.CLOSED,
                            consecutiveProbeSuccesses + " consecutive probe successes"));
                }
                return Optional.empty();
            case OPEN:
            default:
                // Recovery is time-driven; samples while open only feed the latency average.
                return Optional.empty();
        }
    }

    /**
     * Moves an open circuit to half-open once its recovery timeout has elapsed.
     */
    synchronized Optional<Transition> evaluateTimers(Instant now) {
        if (state == CircuitState.OPEN
                && now.toEpochMilli() - openedAtMillis >= upstream.getRecoveryTimeout().toMillis()) {
            state = CircuitState.HALF_OPEN;
            consecutiveProbeSuccesses = 0;
            outstandingProbes.set(0);
            return Optional.of(new Transition(CircuitState.OPEN, CircuitState.HALF_OPEN,
                    "recovery timeout " + upstream.getRecoveryTimeout() + " elapsed"));
        }
        return Optional.empty();
    }

    /**
     * Reserves one of the limited probe slots while half-open.
     */
    boolean tryAcquireProbePermit() {
        if (state != CircuitState.HALF_OPEN) {
            return false;
        }
        while (true) {
            int current = outstandingProbes.get();
            if (current >= halfOpenProbes) {
                return false;
            }
            if (outstandingProbes.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Gives back a probe slot whose request never reported an outcome.
     */
    void releaseProbePermit() {
        outstandingProbes.updateAndGet(n -> Math.max(0, n - 1));
    }

    private Transition open(Instant now, String cause) {
        CircuitState from = state;
        state = CircuitState.OPEN;
        openedAtMillis = now.toEpochMilli();
        consecutiveProbeSuccesses = 0;
        outstandingProbes.set(0);
        window.reset();
        return new Transition(from, CircuitState.OPEN, cause);
    }

    public UpstreamService getUpstream() {
        return upstream;
    }

    public CircuitState getState() {
        return state;
    }

    /**
     * Smoothed latency of successful samples, NaN until the first one arrives.
     */
    public double getLatencyMs() {
        return latencyMs;
    }

    synchronized double failureRatio(Instant now) {
        return window.failureRatio(now.toEpochMilli());
    }

    synchronized int sampleCount(Instant now) {
        return window.total(now.toEpochMilli());
    }

    int getOutstandingProbes() {
        return outstandingProbes.get();
    }

    static final class Transition {
        private final CircuitState from;
        private final CircuitState to;
        private final String cause;

        Transition(CircuitState from, CircuitState to, String cause) {
            this.from = from;
            this.to = to;
            this.cause = cause;
        }

        CircuitState getFrom() {
            return from;
        }

        CircuitState getTo() {
            return to;
        }

        String getCause() {
            return cause;
        }
    }
}
