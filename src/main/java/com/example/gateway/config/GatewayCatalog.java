package com.example.gateway.config;

import com.example.gateway.exception.InvalidConfigurationException;
import com.example.gateway.model.PriorityClass;
import com.example.gateway.model.Principal;
import com.example.gateway.model.RateLimitRule;
import com.example.gateway.model.RouteDefinition;
import com.example.gateway.model.Tier;
import com.example.gateway.model.UpstreamService;
import org.springframework.util.AntPathMatcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable, validated view of principals, rule templates, upstreams and routes.
 * <p>
 * Built once from {@link GatewayProperties}. Every problem found is collected and reported together
 * so a malformed configuration is rejected at startup instead of being defaulted silently.
 */
public final class GatewayCatalog {

    private static final AntPathMatcher MATCHER = new AntPathMatcher();

    private final Map<String, Principal> principals;
    private final Map<Tier, List<RateLimitRule>> tierRules;
    private final Map<Tier, PriorityClass> tierClasses;
    private final Map<String, UpstreamService> upstreams;
    private final List<RouteDefinition> routes;

    public GatewayCatalog(
            Map<String, Principal> principals,
            Map<Tier, List<RateLimitRule>> tierRules,
            Map<Tier, PriorityClass> tierClasses,
            Map<String, UpstreamService> upstreams,
            List<RouteDefinition> routes
    ) {
        this.principals = Collections.unmodifiableMap(new LinkedHashMap<>(principals));
        Map<Tier, List<RateLimitRule>> rulesCopy = new EnumMap<>(Tier.class);
        tierRules.forEach((tier, rules) -> rulesCopy.put(tier, List.copyOf(rules)));
        this.tierRules = Collections.unmodifiableMap(rulesCopy);
        Map<Tier, PriorityClass> classesCopy = new EnumMap<>(Tier.class);
        classesCopy.putAll(tierClasses);
        this.tierClasses = Collections.unmodifiableMap(classesCopy);
        this.upstreams = Collections.unmodifiableMap(new LinkedHashMap<>(upstreams));
        this.routes = List.copyOf(routes);
    }

    public static GatewayCatalog from(GatewayProperties properties) {
        List<String> problems = new ArrayList<>();

        Map<Tier, List<RateLimitRule>> tierRules = new EnumMap<>(Tier.class);
        properties.getTiers().forEach((tier, tierProperties) ->
                tierRules.put(tier, buildRules("tier:" + tier.name(), tierProperties.getRules(), problems)));

        Map<String, Principal> principals = new LinkedHashMap<>();
        for (GatewayProperties.PrincipalProperties p : properties.getPrincipals()) {
            if (p.getId() == null || p.getId().isBlank() || p.getTier() == null) {
                problems.add("principal entries need an id and a tier");
                continue;
            }
            if (principals.containsKey(p.getId())) {
                problems.add("duplicate principal id " + p.getId());
                continue;
            }
            List<RateLimitRule> rules = buildRules("principal:" + p.getId(), p.getRules(), problems);
            principals.put(p.getId(), new Principal(p.getId(), p.getTier(), rules, p.getEventBindings()));
        }

        Map<String, UpstreamService> upstreams = new LinkedHashMap<>();
        for (GatewayProperties.UpstreamProperties u : properties.getUpstreams()) {
            if (u.getId() == null || u.getId().isBlank()) {
                problems.add("upstream entries need an id");
                continue;
            }
            if (upstreams.containsKey(u.getId())) {
                problems.add("duplicate upstream id " + u.getId());
                continue;
            }
            if (!(u.getFailureThreshold() > 0.0 && u.getFailureThreshold() <= 1.0)) {
                problems.add("upstream " + u.getId() + ": failure-threshold must be in (0, 1]");
            }
            if (!isPositive(u.getRecoveryTimeout())) {
                problems.add("upstream " + u.getId() + ": recovery-timeout must be positive");
                continue;
            }
            if (u.getMaxConcurrency() < 1 || u.getMinimumSamples() < 1) {
                problems.add("upstream " + u.getId() + ": max-concurrency and minimum-samples must be >= 1");
            }
            upstreams.put(u.getId(), new UpstreamService(
                    u.getId(),
                    u.getFailureThreshold(),
                    u.getRecoveryTimeout(),
                    u.isCriticalPath(),
                    u.getMaxConcurrency(),
                    u.getHealthUrl(),
                    u.getMinimumSamples()));
        }

        List<RouteDefinition> routes = new ArrayList<>();
        for (GatewayProperties.RouteProperties r : properties.getRoutes()) {
            if (r.getResourcePattern() == null || r.getUpstreams() == null || r.getUpstreams().isEmpty()) {
                problems.add("route entries need a resource-pattern and at least one upstream");
                continue;
            }
            for (String upstream : r.getUpstreams()) {
                if (!upstreams.containsKey(upstream)) {
                    problems.add("route " + r.getResourcePattern() + " references unknown upstream " + upstream);
                }
            }
            if (r.getFallback() != null && !upstreams.containsKey(r.getFallback())) {
                problems.add("route " + r.getResourcePattern() + " references unknown fallback " + r.getFallback());
            }
            List<String> emergency = r.getEmergencyUpstreams() != null ? r.getEmergencyUpstreams() : List.of();
            for (String upstream : emergency) {
                if (!upstreams.containsKey(upstream)) {
                    problems.add("route " + r.getResourcePattern() + " references unknown emergency upstream " + upstream);
                }
            }
            routes.add(new RouteDefinition(r.getResourcePattern(), r.getUpstreams(), r.getFallback(), emergency));
        }

        GatewayProperties.Routing routing = properties.getRouting();
        if (!(routing.getReservedFraction() >= 0.0 && routing.getReservedFraction() < 1.0)) {
            problems.add("routing.reserved-fraction must be in [0, 1)");
        }
        GatewayProperties.Health health = properties.getHealth();
        if (!isPositive(health.getProbeInterval()) || !isPositive(health.getProbeTimeout())
                || !isPositive(health.getAggregationInterval()) || health.getRollingWindow().getSeconds() < 1) {
            problems.add("health intervals must be positive and rolling-window at least one second");
        }
        if (!isPositive(properties.getOverrides().getMaxDuration())) {
            problems.add("overrides.max-duration must be positive");
        }

        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(problems);
        }
        return new GatewayCatalog(principals, tierRules, properties.getTierClasses(), upstreams, routes);
    }

    private static List<RateLimitRule> buildRules(
            String owner,
            List<GatewayProperties.RuleProperties> ruleProperties,
            List<String> problems
    ) {
        List<RateLimitRule> rules = new ArrayList<>();
        for (GatewayProperties.RuleProperties rp : ruleProperties) {
            String name = owner + ":" + rp.getResourcePattern();
            if (rp.getResourcePattern() == null || rp.getBaseQuota() == null) {
                problems.add(owner + ": rules need a resource-pattern and a base-quota");
                continue;
            }
            try {
                rules.add(new RateLimitRule(
                        name,
                        rp.getResourcePattern(),
                        rp.getBaseQuota(),
                        rp.getWindow(),
                        rp.getPriorityMultiplier(),
                        rp.isCriticalPath()));
            } catch (IllegalArgumentException ex) {
                problems.add(ex.getMessage());
            }
        }
        return rules;
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    public Optional<Principal> findPrincipal(String principalId) {
        return Optional.ofNullable(principals.get(principalId));
    }

    /**
     * The most specific rule covering {@code resource}, looking at the principal's own rules before
     * its tier template.
     */
    public Optional<RateLimitRule> resolveRule(Principal principal, String resource) {
        Optional<RateLimitRule> own = mostSpecific(principal.getRules(), RateLimitRule::getResourcePattern, resource);
        if (own.isPresent()) {
            return own;
        }
        return mostSpecific(tierRules.getOrDefault(principal.getTier(), List.of()), RateLimitRule::getResourcePattern, resource);
    }

    public Optional<RouteDefinition> resolveRoute(String resource) {
        return mostSpecific(routes, RouteDefinition::getResourcePattern, resource);
    }

    public PriorityClass baseClassOf(Tier tier) {
        return tierClasses.getOrDefault(tier, PriorityClass.NORMAL);
    }

    public Optional<UpstreamService> findUpstream(String upstreamId) {
        return Optional.ofNullable(upstreams.get(upstreamId));
    }

    public Collection<UpstreamService> getUpstreams() {
        return upstreams.values();
    }

    public Collection<Principal> getPrincipals() {
        return principals.values();
    }

    private static <T> Optional<T> mostSpecific(
            List<T> candidates,
            Function<T, String> patternOf,
            String resource
    ) {
        Comparator<String> specificity = MATCHER.getPatternComparator(resource);
        return candidates.stream()
                .filter(candidate -> MATCHER.match(patternOf.apply(candidate), resource))
                .min((a, b) -> specificity.compare(patternOf.apply(a), patternOf.apply(b)));
    }
}
