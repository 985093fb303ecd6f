package com.example.gateway.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-process counter store for local runs and tests.
 * <p>
 * {@link ConcurrentMap#compute} runs the check and the increment under the key's bin lock, so
 * concurrent consumers of one key are serialized.
 */
@Component
@ConditionalOnProperty(prefix = "gateway", name = "counter-store", havingValue = "memory")
public class InMemoryCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCounterStore.class);

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CounterResult consume(String key, long cost, long limit, Duration ttl) {
        long now = clock.millis();
        long[] outcome = new long[2];
        counters.compute(key, (k, existing) -> {
            Counter current = existing == null || existing.expiresAt <= now
                    ? new Counter(0L, now + Math.max(1L, ttl.toMillis()))
                    : existing;
            if (current.count + cost > limit) {
                outcome[0] = 0L;
                outcome[1] = current.count;
                return current;
            }
            outcome[0] = 1L;
            outcome[1] = current.count + cost;
            return new Counter(current.count + cost, current.expiresAt);
        });
        return new CounterResult(outcome[0] == 1L, outcome[1]);
    }

    /**
     * Discards counters whose bucket has closed.
     */
    @Scheduled(fixedDelayString = "${gateway.memory-store-eviction-ms:5000}")
    public void evictExpired() {
        long now = clock.millis();
        int before = counters.size();
        counters.entrySet().removeIf(entry -> entry.getValue().expiresAt <= now);
        int evicted = before - counters.size();
        if (evicted > 0) {
            log.debug("Evicted {} closed quota windows", evicted);
        }
    }

    int size() {
        return counters.size();
    }

    private static final class Counter {
        private final long count;
        private final long expiresAt;

        private Counter(long count, long expiresAt) {
            this.count = count;
            this.expiresAt = expiresAt;
        }
    }
}
