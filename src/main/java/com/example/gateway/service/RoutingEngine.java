package com.example.gateway.service;

import com.example.gateway.config.GatewayCatalog;
import com.example.gateway.config.GatewayProperties;
import com.example.gateway.health.HealthMonitor;
import com.example.gateway.model.CircuitState;
import com.example.gateway.model.PriorityClass;
import com.example.gateway.model.RouteDefinition;
import com.example.gateway.model.UpstreamService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Picks the upstream an admitted request goes to.
 * <p>
 * Open circuits are skipped, except critical-path upstreams which keep a small trickle of
 * degraded traffic. Half-open upstreams take traffic only through their probe permits. Among the
 * rest the lowest smoothed latency wins; near-ties are split by failure ratio and utilization,
 * and the healthiest rotate round-robin. Routes may name emergency upstreams that the highest
 * classes try first. A share of every upstream's concurrency is held back for high-priority classes.
 */
@Service
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final GatewayCatalog catalog;
    private final HealthMonitor healthMonitor;
    private final GatewayProperties.Routing routing;
    private final Clock clock;

    private final ConcurrentMap<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, UpstreamLease> leases = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> rotation = new ConcurrentHashMap<>();

    public RoutingEngine(
            GatewayCatalog catalog,
            HealthMonitor healthMonitor,
            GatewayProperties properties,
            Clock clock
    ) {
        this.catalog = catalog;
        this.healthMonitor = healthMonitor;
        this.routing = properties.getRouting();
        this.clock = clock;
        for (UpstreamService upstream : catalog.getUpstreams()) {
            inFlight.put(upstream.getId(), new AtomicInteger());
        }
    }

    public RouteResult route(PriorityClass priorityClass, RouteDefinition route) {
        boolean emergency = priorityClass.isAtLeast(routing.getEmergencyMinClass())
                && !route.getEmergencyUpstreams().isEmpty();
        List<Candidate> emergencyCandidates = emergency
                ? candidates(route.getEmergencyUpstreams())
                : List.of();
        for (Candidate candidate : order(route.getResourcePattern() + "#emergency", emergencyCandidates)) {
            UpstreamLease lease = tryAcquire(candidate, priorityClass);
            if (lease != null) {
                log.debug("Routing {} request for {} to emergency upstream {}",
                        priorityClass, route.getResourcePattern(), candidate.upstream.getId());
                return RouteResult.routed(lease, candidate.state == CircuitState.OPEN);
            }
        }

        List<Candidate> candidates = candidates(route.getUpstreams());
        for (Candidate candidate : order(route.getResourcePattern(), candidates)) {
            UpstreamLease lease = tryAcquire(candidate, priorityClass);
            if (lease != null) {
                boolean degraded = candidate.state == CircuitState.OPEN;
                return RouteResult.routed(lease, degraded);
            }
        }

        if (route.getFallback() != null) {
            UpstreamService fallback = catalog.findUpstream(route.getFallback()).orElse(null);
            if (fallback != null) {
                UpstreamLease lease = acquireSlot(fallback, slotLimit(fallback, priorityClass), false);
                if (lease != null) {
                    log.warn("No candidate for {} available, routing {} traffic to fallback {}",
                            route.getResourcePattern(), priorityClass, fallback.getId());
                    return RouteResult.routed(lease, true);
                }
            }
        }

        String rejection = candidates.isEmpty() && emergencyCandidates.isEmpty()
                ? RouteResult.NO_HEALTHY_UPSTREAM
                : RouteResult.UPSTREAMS_SATURATED;
        log.debug("Rejecting {} request for {}: {}", priorityClass, route.getResourcePattern(), rejection);
        return RouteResult.rejected(rejection);
    }

    /**
     * Frees the slot held by a lease. Unknown or already released leases are ignored.
     */
    public Optional<UpstreamLease> release(String leaseId) {
        if (leaseId == null) {
            return Optional.empty();
        }
        UpstreamLease lease = leases.remove(leaseId);
        if (lease != null) {
            decrement(lease.getUpstreamId());
        }
        return Optional.ofNullable(lease);
    }

    /**
     * Reclaims slots whose callers never reported back, so lost outcomes cannot leak capacity.
     */
    public int reclaimExpiredLeases() {
        Instant cutoff = clock.instant().minus(routing.getLeaseTimeout());
        int reclaimed = 0;
        for (UpstreamLease lease : leases.values()) {
            if (lease.getAcquiredAt().isBefore(cutoff) && leases.remove(lease.getId(), lease)) {
                decrement(lease.getUpstreamId());
                if (lease.isProbe()) {
                    healthMonitor.releaseProbePermit(lease.getUpstreamId());
                }
                reclaimed++;
            }
        }
        if (reclaimed > 0) {
            log.warn("Reclaimed {} upstream leases older than {}", reclaimed, routing.getLeaseTimeout());
        }
        return reclaimed;
    }

    public int inFlight(String upstreamId) {
        AtomicInteger counter = inFlight.get(upstreamId);
        return counter != null ? counter.get() : 0;
    }

    /**
     * Slots of {@code upstream} only classes at or above the reserved minimum class may use.
     * Never the whole capacity.
     */
    public int reservedSlots(UpstreamService upstream) {
        int max = upstream.getMaxConcurrency();
        if (max <= 1) {
            return 0;
        }
        int reserved = (int) Math.ceil(max * routing.getReservedFraction());
        return Math.min(reserved, max - 1);
    }

    private List<Candidate> candidates(List<String> upstreamIds) {
        List<Candidate> candidates = new ArrayList<>();
        for (String upstreamId : upstreamIds) {
            Optional<UpstreamService> upstream = catalog.findUpstream(upstreamId);
            if (upstream.isEmpty()) {
                continue;
            }
            CircuitState state = healthMonitor.stateOf(upstreamId);
            if (state == CircuitState.OPEN && !upstream.get().isCriticalPath()) {
                continue;
            }
            candidates.add(new Candidate(
                    upstream.get(), state, healthMonitor.latencyOf(upstreamId), healthScore(upstream.get())));
        }
        return candidates;
    }

    /**
     * Failure ratio plus utilization; lower is healthier.
     */
    private double healthScore(UpstreamService upstream) {
        double utilization = (double) inFlight(upstream.getId()) / upstream.getMaxConcurrency();
        return healthMonitor.failureRatioOf(upstream.getId()) + utilization;
    }

    private List<Candidate> order(String rotationKey, List<Candidate> candidates) {
        List<Candidate> ordered = new ArrayList<>();
        for (int rank = 0; rank < 3; rank++) {
            List<Candidate> group = new ArrayList<>();
            for (Candidate candidate : candidates) {
                if (candidate.rank() == rank) {
                    group.add(candidate);
                }
            }
            if (!group.isEmpty()) {
                ordered.addAll(byLatency(rotationKey, group));
            }
        }
        return ordered;
    }

    /**
     * Fastest first. Candidates within the latency tolerance of the fastest are split by health
     * score: those close to the best score rotate round-robin, the rest follow healthiest first.
     */
    private List<Candidate> byLatency(String rotationKey, List<Candidate> group) {
        group.sort(Comparator.comparingDouble(Candidate::latencyForOrdering));
        double best = group.get(0).latencyForOrdering();
        double tolerance = routing.getLatencyTolerance().toMillis();

        List<Candidate> tied = new ArrayList<>();
        List<Candidate> rest = new ArrayList<>();
        for (Candidate candidate : group) {
            double latency = candidate.latencyForOrdering();
            boolean tie = Double.isInfinite(best) ? Double.isInfinite(latency) : latency - best <= tolerance;
            (tie ? tied : rest).add(candidate);
        }

        tied.sort(Comparator.comparingDouble((Candidate c) -> c.healthScore));
        double bestScore = tied.get(0).healthScore;
        List<Candidate> rotating = new ArrayList<>();
        List<Candidate> lessHealthy = new ArrayList<>();
        for (Candidate candidate : tied) {
            (candidate.healthScore - bestScore <= routing.getHealthScoreTolerance() ? rotating : lessHealthy).add(candidate);
        }
        if (rotating.size() > 1) {
            // Rotation follows latency order, not score order.
            rotating.sort(Comparator.comparingInt(group::indexOf));
            long turn = rotation.computeIfAbsent(rotationKey, k -> new AtomicLong()).getAndIncrement();
            int offset = (int) Math.floorMod(turn, (long) rotating.size());
            List<Candidate> rotated = new ArrayList<>(rotating.subList(offset, rotating.size()));
            rotated.addAll(rotating.subList(0, offset));
            rotating = rotated;
        }
        rotating.addAll(lessHealthy);
        rotating.addAll(rest);
        return rotating;
    }

    private UpstreamLease tryAcquire(Candidate candidate, PriorityClass priorityClass) {
        UpstreamService upstream = candidate.upstream;
        switch (candidate.state) {
            case CLOSED:
                return acquireSlot(upstream, slotLimit(upstream, priorityClass), false);
            case HALF_OPEN:
                if (!healthMonitor.tryAcquireProbePermit(upstream.getId())) {
                    return null;
                }
                UpstreamLease probe = acquireSlot(upstream, slotLimit(upstream, priorityClass), true);
                if (probe == null) {
                    healthMonitor.releaseProbePermit(upstream.getId());
                }
                return probe;
            case OPEN:
                // Only critical-path upstreams reach here.
                int trickle = Math.min(routing.getCriticalTrickleConcurrency(), upstream.getMaxConcurrency());
                return acquireSlot(upstream, trickle, false);
            default:
                return null;
        }
    }

    private int slotLimit(UpstreamService upstream, PriorityClass priorityClass) {
        int max = upstream.getMaxConcurrency();
        if (priorityClass.isAtLeast(routing.getReservedMinClass())) {
            return max;
        }
        return max - reservedSlots(upstream);
    }

    private UpstreamLease acquireSlot(UpstreamService upstream, int limit, boolean probe) {
        AtomicInteger counter = inFlight.computeIfAbsent(upstream.getId(), k -> new AtomicInteger());
        while (true) {
            int current = counter.get();
            if (current >= limit) {
                return null;
            }
            if (counter.compareAndSet(current, current + 1)) {
                UpstreamLease lease = new UpstreamLease(UUID.randomUUID().toString(), upstream.getId(), clock.instant(), probe);
                leases.put(lease.getId(), lease);
                return lease;
            }
        }
    }

    private void decrement(String upstreamId) {
        AtomicInteger counter = inFlight.get(upstreamId);
        if (counter != null) {
            counter.updateAndGet(n -> Math.max(0, n - 1));
        }
    }

    private static final class Candidate {
        private final UpstreamService upstream;
        private final CircuitState state;
        private final double latencyMs;
        private final double healthScore;

        private Candidate(UpstreamService upstream, CircuitState state, double latencyMs, double healthScore) {
            this.upstream = upstream;
            this.state = state;
            this.latencyMs = latencyMs;
            this.healthScore = healthScore;
        }

        /**
         * Healthy upstreams first, then half-open probes, then degraded trickles.
         */
        private int rank() {
            switch (state) {
                case CLOSED:
                    return 0;
                case HALF_OPEN:
                    return 1;
                default:
                    return 2;
            }
        }

        private double latencyForOrdering() {
            return Double.isNaN(latencyMs) ? Double.POSITIVE_INFINITY : latencyMs;
        }
    }
}
