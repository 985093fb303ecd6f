package com.example.gateway.service;

import com.example.gateway.config.GatewayCatalog;
import com.example.gateway.config.GatewayProperties;
import com.example.gateway.exception.OverrideRejectedException;
import com.example.gateway.model.EmergencyOverride;
import com.example.gateway.model.OverrideEffect;
import com.example.gateway.model.OverrideRequest;
import com.example.gateway.model.OverrideScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Holds operator-issued emergency overrides.
 * <p>
 * Only the administrative path writes here; the request path only reads, so classification never
 * contends on a lock. Every override carries a finite expiry and is ignored once it has passed,
 * whether or not the periodic prune has removed it yet.
 */
@Service
public class EmergencyOverrideRegistry {

    private static final Logger log = LoggerFactory.getLogger(EmergencyOverrideRegistry.class);

    private final ConcurrentMap<String, EmergencyOverride> overrides = new ConcurrentHashMap<>();
    private final GatewayCatalog catalog;
    private final GatewayProperties properties;
    private final Clock clock;

    public EmergencyOverrideRegistry(GatewayCatalog catalog, GatewayProperties properties, Clock clock) {
        this.catalog = catalog;
        this.properties = properties;
        this.clock = clock;
    }

    public EmergencyOverride create(OverrideRequest request) {
        Instant now = clock.instant();
        validate(request, now);

        String target = request.getScope() == OverrideScope.GLOBAL ? null : request.getTarget();
        EmergencyOverride override = new EmergencyOverride(
                UUID.randomUUID().toString(),
                request.getScope(),
                target,
                request.getEffect(),
                request.getEffect() == OverrideEffect.QUOTA_MULTIPLIER ? request.getFactor() : null,
                request.getEffect() == OverrideEffect.QUOTA_MULTIPLIER ? null : request.getPriorityClass(),
                now,
                request.getExpiresAt(),
                request.getIssuedBy(),
                request.getReason());
        overrides.put(override.getId(), override);
        log.warn("Emergency override created: {} reason={}", override, override.getReason());
        return override;
    }

    /**
     * Ends an override now. Expiring an already inert override leaves it unchanged.
     */
    public Optional<EmergencyOverride> expire(String overrideId, String expiredBy) {
        Instant now = clock.instant();
        EmergencyOverride updated = overrides.computeIfPresent(overrideId,
                (id, existing) -> existing.isActiveAt(now) ? existing.expiredAt(now) : existing);
        if (updated != null) {
            log.warn("Emergency override {} expired by {}", overrideId, expiredBy);
        }
        return Optional.ofNullable(updated);
    }

    /**
     * Overrides in effect right now for a principal and, if given, an event.
     */
    public List<EmergencyOverride> activeFor(String principalId, String eventId) {
        Instant now = clock.instant();
        return overrides.values().stream()
                .filter(o -> o.isActiveAt(now))
                .filter(o -> o.appliesTo(principalId, eventId))
                .collect(Collectors.toList());
    }

    public List<EmergencyOverride> active() {
        Instant now = clock.instant();
        return overrides.values().stream()
                .filter(o -> o.isActiveAt(now))
                .sorted(Comparator.comparing(EmergencyOverride::getExpiresAt))
                .collect(Collectors.toList());
    }

    /**
     * Drops overrides that have expired. Expired overrides are already inert; this only frees memory.
     */
    @Scheduled(fixedDelayString = "${gateway.overrides.prune-interval-ms:60000}")
    public void pruneExpired() {
        Instant now = clock.instant();
        overrides.values().removeIf(o -> !o.isActiveAt(now));
    }

    private void validate(OverrideRequest request, Instant now) {
        if (request.getScope() == null || request.getEffect() == null) {
            throw new OverrideRejectedException("scope and effect are required");
        }
        if (request.getIssuedBy() == null || request.getIssuedBy().isBlank()) {
            throw new OverrideRejectedException("issuedBy is required");
        }
        if (request.getExpiresAt() == null || !request.getExpiresAt().isAfter(now)) {
            throw new OverrideRejectedException("expiresAt must be in the future");
        }
        if (request.getExpiresAt().isAfter(now.plus(properties.getOverrides().getMaxDuration()))) {
            throw new OverrideRejectedException(
                    "expiresAt may be at most " + properties.getOverrides().getMaxDuration() + " ahead");
        }
        if (request.getScope() != OverrideScope.GLOBAL
                && (request.getTarget() == null || request.getTarget().isBlank())) {
            throw new OverrideRejectedException(request.getScope() + " overrides need a target");
        }
        if (request.getScope() == OverrideScope.PRINCIPAL && catalog.findPrincipal(request.getTarget()).isEmpty()) {
            throw new OverrideRejectedException("unknown principal " + request.getTarget());
        }
        if (request.getEffect() == OverrideEffect.QUOTA_MULTIPLIER) {
            Double factor = request.getFactor();
            if (factor == null || !(factor >= 1.0) || factor.isInfinite()) {
                throw new OverrideRejectedException("QUOTA_MULTIPLIER overrides need a finite factor >= 1");
            }
        } else if (request.getPriorityClass() == null) {
            throw new OverrideRejectedException(request.getEffect() + " overrides need a priorityClass");
        }
    }
}
