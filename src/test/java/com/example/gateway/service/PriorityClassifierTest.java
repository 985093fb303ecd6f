package com.example.gateway.service;

import com.example.gateway.config.GatewayCatalog;
import com.example.gateway.config.GatewayProperties;
import com.example.gateway.model.Classification;
import com.example.gateway.model.OverrideEffect;
import com.example.gateway.model.OverrideRequest;
import com.example.gateway.model.OverrideScope;
import com.example.gateway.model.PriorityClass;
import com.example.gateway.model.Principal;
import com.example.gateway.model.RateLimitRule;
import com.example.gateway.model.RequestContext;
import com.example.gateway.support.GatewayFixtures;
import com.example.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityClassifierTest {

    private static final String TODAY = "2026-06-13";

    private MutableClock clock;
    private GatewayProperties properties;
    private GatewayCatalog catalog;
    private EmergencyOverrideRegistry overrides;
    private PriorityClassifier classifier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-06-13T10:00:00Z"));
        properties = GatewayFixtures.properties();
        catalog = GatewayCatalog.from(properties);
        overrides = new EmergencyOverrideRegistry(catalog, properties, clock);
        classifier = new PriorityClassifier(catalog, overrides, properties, clock);
    }

    private Principal principal(String id) {
        return catalog.findPrincipal(id).orElseThrow();
    }

    @Test
    void shouldUseTierClassWithoutContext() {
        assertThat(classifier.classify(principal("P1"), null)).isEqualTo(PriorityClass.NORMAL);
        assertThat(classifier.classify(principal("P-free"), RequestContext.empty())).isEqualTo(PriorityClass.LOW);
    }

    @Test
    @DisplayName("An event happening today lifts the request to at least HIGH")
    void shouldBoostEventHappeningToday() {
        Classification result = classifier.evaluate(principal("P1"), new RequestContext("wedding-7", TODAY, null));

        assertThat(result.getPriorityClass()).isEqualTo(PriorityClass.HIGH);
        assertThat(result.isEventDay()).isTrue();
    }

    @Test
    void shouldNotBoostFutureOrMissingOrMalformedDates() {
        Principal p1 = principal("P1");

        assertThat(classifier.classify(p1, new RequestContext("wedding-7", "2026-06-14", null)))
                .isEqualTo(PriorityClass.NORMAL);
        assertThat(classifier.classify(p1, new RequestContext("wedding-7", null, null)))
                .isEqualTo(PriorityClass.NORMAL);
        assertThat(classifier.evaluate(p1, new RequestContext("wedding-7", "13/06/2026", null)).isEventDay())
                .isFalse();
    }

    @Test
    void shouldHonourCriticalUrgencyOnlyOnEventDay() {
        Principal p1 = principal("P1");

        assertThat(classifier.classify(p1, new RequestContext("wedding-7", TODAY, "CRITICAL")))
                .isEqualTo(PriorityClass.CRITICAL);
        assertThat(classifier.classify(p1, new RequestContext("wedding-7", "2026-07-01", "critical")))
                .isEqualTo(PriorityClass.NORMAL);
    }

    @Test
    void shouldEvaluateTodayInConfiguredZone() {
        properties.setZoneId(ZoneId.of("Pacific/Auckland"));
        clock.set(Instant.parse("2026-06-13T13:00:00Z"));

        assertThat(classifier.classify(principal("P1"), new RequestContext("wedding-7", "2026-06-14", null)))
                .isEqualTo(PriorityClass.HIGH);
    }

    @Test
    void shouldOnlyLetBoundPrincipalsClaimTheirOwnEvents() {
        Principal caterer = principal("caterer");

        assertThat(classifier.classify(caterer, new RequestContext("wedding-42", TODAY, null)))
                .isEqualTo(PriorityClass.HIGH);
        assertThat(classifier.classify(caterer, new RequestContext("wedding-99", TODAY, null)))
                .isEqualTo(PriorityClass.NORMAL);
        assertThat(classifier.classify(caterer, new RequestContext(null, TODAY, null)))
                .isEqualTo(PriorityClass.NORMAL);
    }

    @Test
    void shouldApplyPriorityFloorUntilItExpires() {
        overrides.create(request(OverrideScope.PRINCIPAL, "P1", OverrideEffect.PRIORITY_FLOOR,
                PriorityClass.CRITICAL, null, Duration.ofMinutes(30)));

        assertThat(classifier.classify(principal("P1"), null)).isEqualTo(PriorityClass.CRITICAL);

        clock.advance(Duration.ofMinutes(30));

        assertThat(classifier.classify(principal("P1"), null)).isEqualTo(PriorityClass.NORMAL);
    }

    @Test
    void shouldApplyCeilingAfterEventBoost() {
        overrides.create(request(OverrideScope.GLOBAL, null, OverrideEffect.PRIORITY_CEILING,
                PriorityClass.NORMAL, null, Duration.ofHours(1)));

        assertThat(classifier.classify(principal("P1"), new RequestContext("wedding-7", TODAY, "critical")))
                .isEqualTo(PriorityClass.NORMAL);
    }

    @Test
    void shouldApplyEventScopedOverrideOnlyToEntitledClaims() {
        overrides.create(request(OverrideScope.EVENT, "wedding-42", OverrideEffect.PRIORITY_FLOOR,
                PriorityClass.CRITICAL, null, Duration.ofHours(1)));

        assertThat(classifier.classify(principal("caterer"), new RequestContext("wedding-42", null, null)))
                .isEqualTo(PriorityClass.CRITICAL);
        assertThat(classifier.classify(principal("P1"), new RequestContext("wedding-43", null, null)))
                .isEqualTo(PriorityClass.NORMAL);
    }

    @Test
    @DisplayName("an unbound principal naming an event without a date gets none of its overrides")
    void shouldIgnoreEventOverrideForUnverifiedClaim() {
        overrides.create(request(OverrideScope.EVENT, "wedding-42", OverrideEffect.PRIORITY_FLOOR,
                PriorityClass.CRITICAL, null, Duration.ofHours(1)));

        assertThat(classifier.classify(principal("P-free"), new RequestContext("wedding-42", null, null)))
                .isEqualTo(PriorityClass.LOW);
        assertThat(classifier.classify(principal("P-free"), new RequestContext("wedding-42", "2026-06-20", null)))
                .isEqualTo(PriorityClass.LOW);
        assertThat(classifier.classify(principal("P-free"), new RequestContext("wedding-42", TODAY, null)))
                .isEqualTo(PriorityClass.CRITICAL);
    }

    @Test
    void shouldCombineEventBoostAndOverrideMultiplier() {
        overrides.create(request(OverrideScope.PRINCIPAL, "P1", OverrideEffect.QUOTA_MULTIPLIER,
                null, 1.5, Duration.ofHours(1)));
        overrides.create(request(OverrideScope.GLOBAL, null, OverrideEffect.QUOTA_MULTIPLIER,
                null, 4.0, Duration.ofHours(1)));
        RateLimitRule rule = catalog.resolveRule(principal("P1"), "/forms/rsvp").orElseThrow();

        Classification onEventDay = classifier.evaluate(principal("P1"), new RequestContext("wedding-7", TODAY, null));
        Classification ordinary = classifier.evaluate(principal("P1"), null);

        assertThat(onEventDay.getOverrideMultiplier()).isEqualTo(4.0);
        assertThat(onEventDay.quotaMultiplierFor(rule)).isEqualTo(8.0);
        assertThat(ordinary.quotaMultiplierFor(rule)).isEqualTo(4.0);
    }

    static OverrideRequest request(
            OverrideScope scope,
            String target,
            OverrideEffect effect,
            PriorityClass priorityClass,
            Double factor,
            Duration lifetime
    ) {
        OverrideRequest request = new OverrideRequest();
        request.setScope(scope);
        request.setTarget(target);
        request.setEffect(effect);
        request.setPriorityClass(priorityClass);
        request.setFactor(factor);
        request.setExpiresAt(Instant.parse("2026-06-13T10:00:00Z").plus(lifetime));
        request.setIssuedBy("ops-oncall");
        request.setReason("wedding-day incident");
        return request;
    }
}
