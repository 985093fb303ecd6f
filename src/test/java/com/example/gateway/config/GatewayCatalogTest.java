package com.example.gateway.config;

import com.example.gateway.exception.InvalidConfigurationException;
import com.example.gateway.model.PriorityClass;
import com.example.gateway.model.Principal;
import com.example.gateway.model.RateLimitRule;
import com.example.gateway.model.Tier;
import com.example.gateway.support.GatewayFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.LIST;

class GatewayCatalogTest {

    @Test
    void shouldResolveMostSpecificTierRule() {
        GatewayCatalog catalog = GatewayCatalog.from(GatewayFixtures.properties());
        Principal p1 = catalog.findPrincipal("P1").orElseThrow();

        assertThat(catalog.resolveRule(p1, "/billing/deposit")).map(RateLimitRule::getBaseQuota).contains(10L);
        assertThat(catalog.resolveRule(p1, "/forms/rsvp")).map(RateLimitRule::getBaseQuota).contains(100L);
    }

    @Test
    void shouldPreferPrincipalRulesOverTierTemplate() {
        GatewayProperties properties = GatewayFixtures.properties();
        properties.getPrincipals().get(0).getRules()
                .add(GatewayFixtures.rule("/**", 7, Duration.ofSeconds(10), 1.0, false));
        GatewayCatalog catalog = GatewayCatalog.from(properties);
        Principal p1 = catalog.findPrincipal("P1").orElseThrow();

        RateLimitRule rule = catalog.resolveRule(p1, "/billing/deposit").orElseThrow();

        assertThat(rule.getBaseQuota()).isEqualTo(7L);
        assertThat(rule.getName()).isEqualTo("principal:P1:/**");
    }

    @Test
    void shouldReportMissingRuleAndRoute() {
        GatewayCatalog catalog = GatewayCatalog.from(GatewayFixtures.properties());

        assertThat(catalog.resolveRule(catalog.findPrincipal("orphan").orElseThrow(), "/forms/rsvp")).isEmpty();
        assertThat(catalog.resolveRoute("/unrouted")).isEmpty();
        assertThat(catalog.resolveRoute("/forms/rsvp").orElseThrow().getFallback()).isEqualTo("spare");
    }

    @Test
    void shouldDefaultUnmappedTierToNormal() {
        GatewayCatalog catalog = new GatewayCatalog(
                Map.of(), Map.of(), Map.of(), Map.of(), List.of());

        assertThat(catalog.baseClassOf(Tier.ENTERPRISE)).isEqualTo(PriorityClass.NORMAL);
        assertThat(GatewayCatalog.from(GatewayFixtures.properties()).baseClassOf(Tier.ENTERPRISE))
                .isEqualTo(PriorityClass.HIGH);
    }

    @Test
    void shouldCollectEveryConfigurationProblem() {
        GatewayProperties properties = GatewayFixtures.properties();
        properties.getPrincipals().add(GatewayFixtures.principal("P1", Tier.FREE, Set.of()));
        properties.getTiers().get(Tier.FREE).getRules()
                .add(GatewayFixtures.rule("/zero/**", 0, Duration.ofMinutes(1), 1.0, false));
        properties.getRoutes().add(GatewayFixtures.route("/video/**", List.of("ghost"), "phantom"));
        properties.getRouting().setReservedFraction(1.0);

        assertThatThrownBy(() -> GatewayCatalog.from(properties))
                .isInstanceOf(InvalidConfigurationException.class)
                .extracting(ex -> ((InvalidConfigurationException) ex).getProblems(), LIST)
                .hasSize(5);
    }

    @Test
    void shouldRejectWindowShorterThanOneSecond() {
        GatewayProperties properties = GatewayFixtures.properties();
        properties.getTiers().get(Tier.FREE).getRules()
                .add(GatewayFixtures.rule("/fast/**", 5, Duration.ofMillis(500), 1.0, false));

        assertThatThrownBy(() -> GatewayCatalog.from(properties))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void shouldCarryEmergencyUpstreamsAndRejectUnknownOnes() {
        GatewayProperties properties = GatewayFixtures.properties();
        properties.getRoutes().get(1).setEmergencyUpstreams(List.of("spare"));
        assertThat(GatewayCatalog.from(properties).resolveRoute("/forms/rsvp").orElseThrow().getEmergencyUpstreams())
                .containsExactly("spare");

        properties.getRoutes().get(1).setEmergencyUpstreams(List.of("ghost"));
        assertThatThrownBy(() -> GatewayCatalog.from(properties))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("unknown emergency upstream ghost");
    }
}
