package com.example.gateway.health;

import com.example.gateway.config.GatewayCatalog;
import com.example.gateway.config.GatewayProperties;
import com.example.gateway.model.CircuitState;
import com.example.gateway.model.UpstreamService;
import com.example.gateway.telemetry.CircuitTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the circuit state of every upstream.
 * <p>
 * Two producers feed it: the periodic {@link HealthProber} and the per-request outcome hook
 * {@link #recordOutcome}. Both only enqueue samples. A single consumer, {@link #aggregate()},
 * drains the queue into each upstream's rolling window and evaluates recovery timers, so circuit
 * state is mutated from one place only.
 */
@Service
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final Map<String, CircuitBreaker> breakers;
    private final BlockingQueue<HealthSample> samples;
    private final Clock clock;
    private final ApplicationEventPublisher events;
    private final AtomicLong droppedSamples = new AtomicLong();

    public HealthMonitor(
            GatewayCatalog catalog,
            GatewayProperties properties,
            Clock clock,
            ApplicationEventPublisher events
    ) {
        this.clock = clock;
        this.events = events;
        GatewayProperties.Health health = properties.getHealth();
        this.samples = new LinkedBlockingQueue<>(health.getSampleQueueCapacity());
        int windowSeconds = (int) Math.max(1L, health.getRollingWindow().getSeconds());
        Map<String, CircuitBreaker> byId = new LinkedHashMap<>();
        for (UpstreamService upstream : catalog.getUpstreams()) {
            byId.put(upstream.getId(), new CircuitBreaker(
                    upstream, windowSeconds, health.getHalfOpenProbes(), health.getLatencySmoothing()));
        }
        this.breakers = Collections.unmodifiableMap(byId);
    }

    /**
     * Passive sample from a real request routed to {@code upstreamId}.
     */
    public void recordOutcome(String upstreamId, boolean success, long latencyMs) {
        recordOutcome(upstreamId, success, latencyMs, false);
    }

    /**
     * Passive sample from a real request; {@code probeLease} marks requests admitted on a
     * half-open probe permit, the only request outcomes that count toward recovery.
     */
    public void recordOutcome(String upstreamId, boolean success, long latencyMs, boolean probeLease) {
        submit(new HealthSample(upstreamId, success, latencyMs, clock.instant(), HealthSample.Source.REQUEST, probeLease));
    }

    /**
     * Enqueues a sample for the next aggregation tick. Never blocks the caller.
     */
    public void submit(HealthSample sample) {
        if (!breakers.containsKey(sample.getUpstreamId())) {
            log.debug("Ignoring health sample for unknown upstream {}", sample.getUpstreamId());
            return;
        }
        if (!samples.offer(sample)) {
            long dropped = droppedSamples.incrementAndGet();
            if (dropped == 1 || dropped % 1000 == 0) {
                log.warn("Health sample queue full, {} samples dropped so far", dropped);
            }
        }
    }

    /**
     * Folds queued samples into the rolling windows, then evaluates recovery timers.
     */
    public synchronized void aggregate() {
        Instant now = clock.instant();
        List<HealthSample> batch = new ArrayList<>();
        samples.drainTo(batch);

        for (HealthSample sample : batch) {
            CircuitBreaker breaker = breakers.get(sample.getUpstreamId());
            breaker.record(sample, now).ifPresent(t -> publish(breaker, t, now));
        }
        for (CircuitBreaker breaker : breakers.values()) {
            breaker.evaluateTimers(now).ifPresent(t -> publish(breaker, t, now));
        }
    }

    public CircuitState stateOf(String upstreamId) {
        CircuitBreaker breaker = breakers.get(upstreamId);
        return breaker != null ? breaker.getState() : CircuitState.OPEN;
    }

    /**
     * Smoothed latency of {@code upstreamId}, NaN while unknown.
     */
    public double latencyOf(String upstreamId) {
        CircuitBreaker breaker = breakers.get(upstreamId);
        return breaker != null ? breaker.getLatencyMs() : Double.NaN;
    }

    /**
     * Reserves a probe slot on a half-open upstream. Released when the request's outcome arrives.
     */
    public boolean tryAcquireProbePermit(String upstreamId) {
        CircuitBreaker breaker = breakers.get(upstreamId);
        return breaker != null && breaker.tryAcquireProbePermit();
    }

    /**
     * Returns a probe slot whose request never reported back.
     */
    public void releaseProbePermit(String upstreamId) {
        CircuitBreaker breaker = breakers.get(upstreamId);
        if (breaker != null) {
            breaker.releaseProbePermit();
        }
    }

    public Optional<CircuitBreaker> breaker(String upstreamId) {
        return Optional.ofNullable(breakers.get(upstreamId));
    }

    public Collection<CircuitBreaker> breakers() {
        return breakers.values();
    }

    public double failureRatioOf(String upstreamId) {
        CircuitBreaker breaker = breakers.get(upstreamId);
        return breaker != null ? breaker.failureRatio(clock.instant()) : 0.0;
    }

    int pendingSamples() {
        return samples.size();
    }

    private void publish(CircuitBreaker breaker, CircuitBreaker.Transition transition, Instant at) {
        String upstreamId = breaker.getUpstream().getId();
        if (transition.getTo() == CircuitState.OPEN && breaker.getUpstream().isCriticalPath()) {
            log.warn("Critical-path upstream {} is open; degrading to a trickle instead of blocking", upstreamId);
        } else {
            log.info("Upstream {} circuit {} -> {}: {}", upstreamId, transition.getFrom(), transition.getTo(), transition.getCause());
        }
        events.publishEvent(new CircuitTransitionEvent(
                upstreamId, transition.getFrom(), transition.getTo(), at, transition.getCause()));
    }
}
