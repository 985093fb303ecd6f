package com.example.gateway.service;

import com.example.gateway.config.GatewayProperties;
import com.example.gateway.exception.StoreUnavailableException;
import com.example.gateway.model.PriorityClass;
import com.example.gateway.model.Principal;
import com.example.gateway.model.QuotaResult;
import com.example.gateway.model.RateLimitRule;
import com.example.gateway.store.CounterResult;
import com.example.gateway.store.CounterStore;
import com.example.gateway.telemetry.FailMode;
import com.example.gateway.telemetry.FailModeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks each principal's consumption against its rules over fixed windows.
 * <p>
 * A window's bucket id is the wall-clock time divided by the window length. The counter for
 * (principal, rule, bucket) lives in the injected {@link CounterStore}, which owns all
 * concurrency control. This service is mostly responsible for:
 * <ul>
 *   <li>deriving the bucket and its key from the clock at the moment of the increment</li>
 *   <li>scaling the base quota by the caller's multiplier</li>
 *   <li>retrying a failed store call once</li>
 *   <li>deciding fail-open vs fail-closed when the store stays unavailable</li>
 * </ul>
 */
@Service
public class QuotaLedger {

    private static final Logger log = LoggerFactory.getLogger(QuotaLedger.class);

    private final CounterStore counterStore;
    private final GatewayProperties properties;
    private final Clock clock;
    private final ApplicationEventPublisher events;

    public QuotaLedger(
            CounterStore counterStore,
            GatewayProperties properties,
            Clock clock,
            ApplicationEventPublisher events
    ) {
        this.counterStore = counterStore;
        this.properties = properties;
        this.clock = clock;
        this.events = events;
    }

    /**
     * Consume {@code cost} units of {@code rule} for {@code principal} in the current window.
     *
     * @param multiplier factor applied to the base quota, from event-day boosts and overrides
     * @param eventBound true if the request was verified as belonging to an event happening today
     * @param priorityClass the request's class; CRITICAL requests are never failed closed
     */
    public QuotaResult checkAndConsume(
            Principal principal,
            RateLimitRule rule,
            long cost,
            double multiplier,
            boolean eventBound,
            PriorityClass priorityClass
    ) {
        long limit = rule.effectiveLimit(multiplier);
        long windowMillis = rule.getWindow().toMillis();

        StoreUnavailableException lastFailure = null;
        for (int attempt = 0; attempt < 2; attempt++) {
            if (attempt > 0 && !backOff()) {
                break;
            }
            // Bucket is derived per attempt so a retry lands in the window that contains it.
            long now = clock.millis();
            long bucket = Math.floorDiv(now, windowMillis);
            Instant resetAt = Instant.ofEpochMilli((bucket + 1) * windowMillis);
            String key = counterKey(principal, rule, bucket);
            try {
                CounterResult result = counterStore.consume(
                        key, cost, limit, Duration.ofMillis(resetAt.toEpochMilli() - now));
                long remaining = Math.max(0L, limit - result.getCount());
                if (result.isAllowed()) {
                    return QuotaResult.allow(remaining, resetAt);
                }
                log.debug("Quota exhausted for {} on {} ({} / {})", principal.getId(), rule.getName(), result.getCount(), limit);
                return QuotaResult.rejectQuotaExceeded(remaining, resetAt);
            } catch (StoreUnavailableException ex) {
                lastFailure = ex;
                log.warn("Counter store unavailable for {} on {} (attempt {})", principal.getId(), rule.getName(), attempt + 1);
            }
        }
        return handleStoreFailure(principal, rule, eventBound, priorityClass, windowMillis, lastFailure);
    }

    private QuotaResult handleStoreFailure(
            Principal principal,
            RateLimitRule rule,
            boolean eventBound,
            PriorityClass priorityClass,
            long windowMillis,
            StoreUnavailableException cause
    ) {
        Instant now = clock.instant();
        Instant resetAt = Instant.ofEpochMilli((Math.floorDiv(now.toEpochMilli(), windowMillis) + 1) * windowMillis);
        String reason = cause != null ? cause.getMessage() : "interrupted during retry";

        if (priorityClass == PriorityClass.CRITICAL || (rule.isCriticalPath() && eventBound)) {
            log.error("Failing open for {} request of {} on rule {}: counter store unavailable",
                    priorityClass, principal.getId(), rule.getName(), cause);
            events.publishEvent(new FailModeEvent(principal.getId(), rule.getName(), FailMode.OPEN, now, reason));
            return QuotaResult.failOpen(resetAt);
        }
        log.error("Failing closed for {} on rule {}: counter store unavailable",
                principal.getId(), rule.getName(), cause);
        events.publishEvent(new FailModeEvent(principal.getId(), rule.getName(), FailMode.CLOSED, now, reason));
        return QuotaResult.rejectStoreFailure(resetAt);
    }

    private boolean backOff() {
        try {
            Thread.sleep(properties.getStoreRetryBackoff().toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String counterKey(Principal principal, RateLimitRule rule, long bucket) {
        return properties.getKeyPrefix() + ":" + principal.getId() + ":" + rule.getName() + ":" + bucket;
    }
}
