package com.example.gateway.service;

import com.example.gateway.config.GatewayProperties;
import com.example.gateway.exception.StoreUnavailableException;
import com.example.gateway.model.PriorityClass;
import com.example.gateway.model.Principal;
import com.example.gateway.model.QuotaDecision;
import com.example.gateway.model.QuotaResult;
import com.example.gateway.model.RateLimitRule;
import com.example.gateway.model.Tier;
import com.example.gateway.store.CounterResult;
import com.example.gateway.store.CounterStore;
import com.example.gateway.store.InMemoryCounterStore;
import com.example.gateway.support.GatewayFixtures;
import com.example.gateway.support.MutableClock;
import com.example.gateway.telemetry.FailMode;
import com.example.gateway.telemetry.FailModeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("QuotaLedger")
class QuotaLedgerTest {

    private static final Principal P1 = new Principal("P1", Tier.STANDARD, List.of(), Set.of());

    private final RateLimitRule rule = new RateLimitRule(
            "tier:STANDARD:/**", "/**", 100, Duration.ofMinutes(1), 2.0, false);
    private final RateLimitRule criticalRule = new RateLimitRule(
            "tier:STANDARD:/billing/**", "/billing/**", 10, Duration.ofMinutes(1), 3.0, true);

    private MutableClock clock;
    private GatewayProperties properties;
    private List<Object> events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-06-13T10:00:05Z"));
        properties = GatewayFixtures.properties();
        events = new CopyOnWriteArrayList<>();
    }

    private QuotaLedger ledger(CounterStore store) {
        return new QuotaLedger(store, properties, clock, events::add);
    }

    @Nested
    @DisplayName("with a healthy store")
    class HealthyStore {

        @Test
        void shouldAllowExactlyTheQuotaUnderConcurrency() throws Exception {
            QuotaLedger ledger = ledger(new InMemoryCounterStore(clock));
            ExecutorService pool = Executors.newFixedThreadPool(16);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<QuotaResult>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < 150; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return ledger.checkAndConsume(P1, rule, 1, 1.0, false, PriorityClass.NORMAL);
                    }));
                }
                start.countDown();

                int allowed = 0;
                int rejected = 0;
                for (Future<QuotaResult> future : futures) {
                    QuotaResult result = future.get(10, TimeUnit.SECONDS);
                    if (result.isAllowed()) {
                        allowed++;
                    } else {
                        assertThat(result.getDecision()).isEqualTo(QuotaDecision.REJECT_QUOTA_EXCEEDED);
                        rejected++;
                    }
                }
                assertThat(allowed).isEqualTo(100);
                assertThat(rejected).isEqualTo(50);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void shouldReportRemainingAndWindowEnd() {
            QuotaLedger ledger = ledger(new InMemoryCounterStore(clock));

            QuotaResult result = ledger.checkAndConsume(P1, rule, 5, 1.0, false, PriorityClass.NORMAL);

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.getRemaining()).isEqualTo(95);
            assertThat(result.getResetAt()).isEqualTo(Instant.parse("2026-06-13T10:01:00Z"));
        }

        @Test
        void shouldStartFreshCountInNextWindow() {
            QuotaLedger ledger = ledger(new InMemoryCounterStore(clock));
            for (int i = 0; i < 100; i++) {
                ledger.checkAndConsume(P1, rule, 1, 1.0, false, PriorityClass.NORMAL);
            }
            assertThat(ledger.checkAndConsume(P1, rule, 1, 1.0, false, PriorityClass.NORMAL).isAllowed()).isFalse();

            clock.advance(Duration.ofSeconds(55));

            QuotaResult result = ledger.checkAndConsume(P1, rule, 1, 1.0, false, PriorityClass.NORMAL);
            assertThat(result.isAllowed()).isTrue();
            assertThat(result.getRemaining()).isEqualTo(99);
        }

        @Test
        void shouldScaleQuotaByMultiplier() {
            QuotaLedger ledger = ledger(new InMemoryCounterStore(clock));

            QuotaResult result = ledger.checkAndConsume(P1, rule, 150, 2.0, true, PriorityClass.HIGH);

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.getRemaining()).isEqualTo(50);
        }

        @Test
        void shouldKeepPrincipalsAndRulesApart() {
            QuotaLedger ledger = ledger(new InMemoryCounterStore(clock));
            Principal other = new Principal("P2", Tier.STANDARD, List.of(), Set.of());

            ledger.checkAndConsume(P1, criticalRule, 10, 1.0, false, PriorityClass.NORMAL);

            assertThat(ledger.checkAndConsume(P1, criticalRule, 1, 1.0, false, PriorityClass.NORMAL).isAllowed()).isFalse();
            assertThat(ledger.checkAndConsume(other, criticalRule, 1, 1.0, false, PriorityClass.NORMAL).isAllowed()).isTrue();
            assertThat(ledger.checkAndConsume(P1, rule, 1, 1.0, false, PriorityClass.NORMAL).isAllowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("with a failing store")
    class FailingStore {

        private final CounterStore store = mock(CounterStore.class);

        @Test
        void shouldRetryOnceBeforeGivingUp() {
            when(store.consume(anyString(), anyLong(), anyLong(), any(Duration.class)))
                    .thenThrow(new StoreUnavailableException("timeout"))
                    .thenReturn(new CounterResult(true, 1));

            QuotaResult result = ledger(store).checkAndConsume(P1, rule, 1, 1.0, false, PriorityClass.NORMAL);

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.isDegraded()).isFalse();
            verify(store, times(2)).consume(anyString(), anyLong(), anyLong(), any(Duration.class));
            assertThat(events).isEmpty();
        }

        @Test
        void shouldFailClosedForOrdinaryTraffic() {
            when(store.consume(anyString(), anyLong(), anyLong(), any(Duration.class)))
                    .thenThrow(new StoreUnavailableException("timeout"));

            QuotaResult result = ledger(store).checkAndConsume(P1, criticalRule, 1, 1.0, false, PriorityClass.NORMAL);

            assertThat(result.getDecision()).isEqualTo(QuotaDecision.REJECT_STORE_FAILURE);
            verify(store, times(2)).consume(anyString(), anyLong(), anyLong(), any(Duration.class));
            assertThat(events).singleElement()
                    .isInstanceOfSatisfying(FailModeEvent.class, e -> assertThat(e.getMode()).isEqualTo(FailMode.CLOSED));
        }

        @Test
        void shouldFailClosedForEventTrafficOnNonCriticalRule() {
            when(store.consume(anyString(), anyLong(), anyLong(), any(Duration.class)))
                    .thenThrow(new StoreUnavailableException("timeout"));

            QuotaResult result = ledger(store).checkAndConsume(P1, rule, 1, 1.0, true, PriorityClass.HIGH);

            assertThat(result.getDecision()).isEqualTo(QuotaDecision.REJECT_STORE_FAILURE);
        }

        @Test
        void shouldFailOpenForCriticalRequestOnAnyRule() {
            when(store.consume(anyString(), anyLong(), anyLong(), any(Duration.class)))
                    .thenThrow(new StoreUnavailableException("timeout"));

            QuotaResult result = ledger(store).checkAndConsume(P1, rule, 1, 2.0, true, PriorityClass.CRITICAL);

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.isDegraded()).isTrue();
            assertThat(events).singleElement()
                    .isInstanceOfSatisfying(FailModeEvent.class, e -> assertThat(e.getMode()).isEqualTo(FailMode.OPEN));
        }

        @Test
        void shouldFailOpenForEventTrafficOnCriticalPathRule() {
            when(store.consume(anyString(), anyLong(), anyLong(), any(Duration.class)))
                    .thenThrow(new StoreUnavailableException("timeout"));

            QuotaResult result = ledger(store).checkAndConsume(P1, criticalRule, 1, 3.0, true, PriorityClass.HIGH);

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.isDegraded()).isTrue();
            assertThat(result.getRemaining()).isEqualTo(-1);
            assertThat(events).singleElement()
                    .isInstanceOfSatisfying(FailModeEvent.class, e -> {
                        assertThat(e.getMode()).isEqualTo(FailMode.OPEN);
                        assertThat(e.getPrincipalId()).isEqualTo("P1");
                        assertThat(e.getRuleName()).isEqualTo(criticalRule.getName());
                    });
        }
    }
}
