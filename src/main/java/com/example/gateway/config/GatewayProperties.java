package com.example.gateway.config;

import com.example.gateway.model.PriorityClass;
import com.example.gateway.model.Tier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Backing store for quota counters: "redis" or "memory".
     */
    private String counterStore = "redis";

    /**
     * Prefix of every counter key written to the store.
     */
    @NotBlank
    private String keyPrefix = "admission";

    /**
     * Zone in which "today" is evaluated for event-day boosts.
     */
    @NotNull
    private ZoneId zoneId = ZoneId.of("UTC");

    /**
     * Pause before the single retry of a failed counter store call.
     */
    @NotNull
    private Duration storeRetryBackoff = Duration.ofMillis(25);

    /**
     * Base priority class of each tier. Tiers left out fall back to NORMAL.
     */
    private Map<Tier, PriorityClass> tierClasses = defaultTierClasses();

    /**
     * Rule templates per tier.
     */
    @Valid
    private Map<Tier, TierProperties> tiers = new EnumMap<>(Tier.class);

    @Valid
    private List<PrincipalProperties> principals = new ArrayList<>();

    @Valid
    private List<UpstreamProperties> upstreams = new ArrayList<>();

    @Valid
    private List<RouteProperties> routes = new ArrayList<>();

    @Valid
    private Routing routing = new Routing();

    @Valid
    private Health health = new Health();

    @Valid
    private Overrides overrides = new Overrides();

    private Filter filter = new Filter();

    private static Map<Tier, PriorityClass> defaultTierClasses() {
        Map<Tier, PriorityClass> classes = new EnumMap<>(Tier.class);
        classes.put(Tier.FREE, PriorityClass.LOW);
        classes.put(Tier.STANDARD, PriorityClass.NORMAL);
        classes.put(Tier.PREMIUM, PriorityClass.NORMAL);
        classes.put(Tier.ENTERPRISE, PriorityClass.HIGH);
        return classes;
    }

    public String getCounterStore() {
        return counterStore;
    }

    public void setCounterStore(String counterStore) {
        this.counterStore = counterStore;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    public void setZoneId(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public Duration getStoreRetryBackoff() {
        return storeRetryBackoff;
    }

    public void setStoreRetryBackoff(Duration storeRetryBackoff) {
        this.storeRetryBackoff = storeRetryBackoff;
    }

    public Map<Tier, PriorityClass> getTierClasses() {
        return tierClasses;
    }

    public void setTierClasses(Map<Tier, PriorityClass> tierClasses) {
        this.tierClasses = tierClasses;
    }

    public Map<Tier, TierProperties> getTiers() {
        return tiers;
    }

    public void setTiers(Map<Tier, TierProperties> tiers) {
        this.tiers = tiers;
    }

    public List<PrincipalProperties> getPrincipals() {
        return principals;
    }

    public void setPrincipals(List<PrincipalProperties> principals) {
        this.principals = principals;
    }

    public List<UpstreamProperties> getUpstreams() {
        return upstreams;
    }

    public void setUpstreams(List<UpstreamProperties> upstreams) {
        this.upstreams = upstreams;
    }

    public List<RouteProperties> getRoutes() {
        return routes;
    }

    public void setRoutes(List<RouteProperties> routes) {
        this.routes = routes;
    }

    public Routing getRouting() {
        return routing;
    }

    public void setRouting(Routing routing) {
        this.routing = routing;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Overrides getOverrides() {
        return overrides;
    }

    public void setOverrides(Overrides overrides) {
        this.overrides = overrides;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public static class TierProperties {

        @Valid
        private List<RuleProperties> rules = new ArrayList<>();

        public List<RuleProperties> getRules() {
            return rules;
        }

        public void setRules(List<RuleProperties> rules) {
            this.rules = rules;
        }
    }

    public static class RuleProperties {

        /**
         * Ant-style pattern of the resources this rule covers, e.g. /billing/**.
         */
        @NotBlank
        private String resourcePattern;

        @NotNull
        @Min(1)
        private Long baseQuota;

        @NotNull
        private Duration window;

        /**
         * Factor applied to the base quota while an event-day boost is active.
         */
        @DecimalMin("1.0")
        private double priorityMultiplier = 1.0;

        /**
         * If true, event-bound traffic under this rule is let through when the counter store is down.
         */
        private boolean criticalPath;

        public String getResourcePattern() {
            return resourcePattern;
        }

        public void setResourcePattern(String resourcePattern) {
            this.resourcePattern = resourcePattern;
        }

        public Long getBaseQuota() {
            return baseQuota;
        }

        public void setBaseQuota(Long baseQuota) {
            this.baseQuota = baseQuota;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public double getPriorityMultiplier() {
            return priorityMultiplier;
        }

        public void setPriorityMultiplier(double priorityMultiplier) {
            this.priorityMultiplier = priorityMultiplier;
        }

        public boolean isCriticalPath() {
            return criticalPath;
        }

        public void setCriticalPath(boolean criticalPath) {
            this.criticalPath = criticalPath;
        }
    }

    public static class PrincipalProperties {

        @NotBlank
        private String id;

        @NotNull
        private Tier tier;

        private Set<String> eventBindings = new LinkedHashSet<>();

        @Valid
        private List<RuleProperties> rules = new ArrayList<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public Tier getTier() {
            return tier;
        }

        public void setTier(Tier tier) {
            this.tier = tier;
        }

        public Set<String> getEventBindings() {
            return eventBindings;
        }

        public void setEventBindings(Set<String> eventBindings) {
            this.eventBindings = eventBindings;
        }

        public List<RuleProperties> getRules() {
            return rules;
        }

        public void setRules(List<RuleProperties> rules) {
            this.rules = rules;
        }
    }

    public static class UpstreamProperties {

        @NotBlank
        private String id;

        /**
         * Failure ratio in the rolling window above which the circuit opens.
         */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double failureThreshold = 0.5;

        @NotNull
        private Duration recoveryTimeout = Duration.ofSeconds(30);

        private boolean criticalPath;

        @Min(1)
        private int maxConcurrency = 100;

        /**
         * Probed with GET on every probe tick. Leave unset for passive sampling only.
         */
        private String healthUrl;

        /**
         * Samples needed in the rolling window before the failure ratio is trusted.
         */
        @Min(1)
        private int minimumSamples = 5;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public double getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(double failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public boolean isCriticalPath() {
            return criticalPath;
        }

        public void setCriticalPath(boolean criticalPath) {
            this.criticalPath = criticalPath;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public String getHealthUrl() {
            return healthUrl;
        }

        public void setHealthUrl(String healthUrl) {
            this.healthUrl = healthUrl;
        }

        public int getMinimumSamples() {
            return minimumSamples;
        }

        public void setMinimumSamples(int minimumSamples) {
            this.minimumSamples = minimumSamples;
        }
    }

    public static class RouteProperties {

        @NotBlank
        private String resourcePattern;

        @NotEmpty
        private List<String> upstreams = new ArrayList<>();

        private String fallback;

        /**
         * Dedicated upstreams tried first for requests at or above {@code routing.emergency-min-class}.
         */
        private List<String> emergencyUpstreams = new ArrayList<>();

        public String getResourcePattern() {
            return resourcePattern;
        }

        public void setResourcePattern(String resourcePattern) {
            this.resourcePattern = resourcePattern;
        }

        public List<String> getUpstreams() {
            return upstreams;
        }

        public void setUpstreams(List<String> upstreams) {
            this.upstreams = upstreams;
        }

        public String getFallback() {
            return fallback;
        }

        public void setFallback(String fallback) {
            this.fallback = fallback;
        }

        public List<String> getEmergencyUpstreams() {
            return emergencyUpstreams;
        }

        public void setEmergencyUpstreams(List<String> emergencyUpstreams) {
            this.emergencyUpstreams = emergencyUpstreams;
        }
    }

    public static class Routing {

        /**
         * Share of each upstream's concurrency reserved for high-priority classes. Must stay below 1.
         */
        @DecimalMin("0.0")
        @DecimalMax(value = "1.0", inclusive = false)
        private double reservedFraction = 0.1;

        /**
         * Lowest priority class allowed to consume the reserved share.
         */
        @NotNull
        private PriorityClass reservedMinClass = PriorityClass.HIGH;

        /**
         * Candidates whose latency is within this distance of the best are treated as tied.
         */
        @NotNull
        private Duration latencyTolerance = Duration.ofMillis(5);

        /**
         * In-flight slots never reported back are reclaimed after this long.
         */
        @NotNull
        private Duration leaseTimeout = Duration.ofSeconds(30);

        /**
         * In-flight requests still admitted to an open critical-path upstream.
         */
        @Min(1)
        private int criticalTrickleConcurrency = 1;

        /**
         * Lowest priority class sent to a route's emergency upstreams before its regular ones.
         */
        @NotNull
        private PriorityClass emergencyMinClass = PriorityClass.CRITICAL;

        /**
         * Latency-tied candidates whose health score (failure ratio plus utilization) is within
         * this distance of the best keep rotating; the others are ordered by score after them.
         */
        @DecimalMin("0.0")
        private double healthScoreTolerance = 0.25;

        public double getReservedFraction() {
            return reservedFraction;
        }

        public void setReservedFraction(double reservedFraction) {
            this.reservedFraction = reservedFraction;
        }

        public PriorityClass getReservedMinClass() {
            return reservedMinClass;
        }

        public void setReservedMinClass(PriorityClass reservedMinClass) {
            this.reservedMinClass = reservedMinClass;
        }

        public Duration getLatencyTolerance() {
            return latencyTolerance;
        }

        public void setLatencyTolerance(Duration latencyTolerance) {
            this.latencyTolerance = latencyTolerance;
        }

        public Duration getLeaseTimeout() {
            return leaseTimeout;
        }

        public void setLeaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
        }

        public int getCriticalTrickleConcurrency() {
            return criticalTrickleConcurrency;
        }

        public void setCriticalTrickleConcurrency(int criticalTrickleConcurrency) {
            this.criticalTrickleConcurrency = criticalTrickleConcurrency;
        }

        public PriorityClass getEmergencyMinClass() {
            return emergencyMinClass;
        }

        public void setEmergencyMinClass(PriorityClass emergencyMinClass) {
            this.emergencyMinClass = emergencyMinClass;
        }

        public double getHealthScoreTolerance() {
            return healthScoreTolerance;
        }

        public void setHealthScoreTolerance(double healthScoreTolerance) {
            this.healthScoreTolerance = healthScoreTolerance;
        }
    }

    public static class Health {

        @NotNull
        private Duration probeInterval = Duration.ofSeconds(10);

        @NotNull
        private Duration probeTimeout = Duration.ofSeconds(2);

        /**
         * How often queued samples are folded into the rolling windows and timers are evaluated.
         */
        @NotNull
        private Duration aggregationInterval = Duration.ofMillis(200);

        @NotNull
        private Duration rollingWindow = Duration.ofSeconds(30);

        /**
         * Consecutive probe successes needed to close a half-open circuit.
         */
        @Min(1)
        private int halfOpenProbes = 3;

        /**
         * Weight of the newest sample in the latency average.
         */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double latencySmoothing = 0.3;

        /**
         * Probe twice as often from Friday to Sunday.
         */
        private boolean weddingWeekendMode = true;

        /**
         * Probe a quarter more often from May to September.
         */
        private boolean peakSeasonMode = true;

        @Min(1)
        private int sampleQueueCapacity = 10_000;

        public Duration getProbeInterval() {
            return probeInterval;
        }

        public void setProbeInterval(Duration probeInterval) {
            this.probeInterval = probeInterval;
        }

        public Duration getProbeTimeout() {
            return probeTimeout;
        }

        public void setProbeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
        }

        public Duration getAggregationInterval() {
            return aggregationInterval;
        }

        public void setAggregationInterval(Duration aggregationInterval) {
            this.aggregationInterval = aggregationInterval;
        }

        public Duration getRollingWindow() {
            return rollingWindow;
        }

        public void setRollingWindow(Duration rollingWindow) {
            this.rollingWindow = rollingWindow;
        }

        public int getHalfOpenProbes() {
            return halfOpenProbes;
        }

        public void setHalfOpenProbes(int halfOpenProbes) {
            this.halfOpenProbes = halfOpenProbes;
        }

        public double getLatencySmoothing() {
            return latencySmoothing;
        }

        public void setLatencySmoothing(double latencySmoothing) {
            this.latencySmoothing = latencySmoothing;
        }

        public boolean isWeddingWeekendMode() {
            return weddingWeekendMode;
        }

        public void setWeddingWeekendMode(boolean weddingWeekendMode) {
            this.weddingWeekendMode = weddingWeekendMode;
        }

        public boolean isPeakSeasonMode() {
            return peakSeasonMode;
        }

        public void setPeakSeasonMode(boolean peakSeasonMode) {
            this.peakSeasonMode = peakSeasonMode;
        }

        public int getSampleQueueCapacity() {
            return sampleQueueCapacity;
        }

        public void setSampleQueueCapacity(int sampleQueueCapacity) {
            this.sampleQueueCapacity = sampleQueueCapacity;
        }
    }

    public static class Overrides {

        /**
         * Longest lifetime an operator may give a single override.
         */
        @NotNull
        private Duration maxDuration = Duration.ofHours(24);

        public Duration getMaxDuration() {
            return maxDuration;
        }

        public void setMaxDuration(Duration maxDuration) {
            this.maxDuration = maxDuration;
        }
    }

    public static class Filter {

        /**
         * In-process paths admitted by the servlet filter.
         */
        private List<String> includePatterns = new ArrayList<>(List.of("/api/v1/**"));

        /**
         * Removed from the request path to obtain the resource name matched against rules and routes.
         */
        private String stripPrefix = "/api/v1";

        public List<String> getIncludePatterns() {
            return includePatterns;
        }

        public void setIncludePatterns(List<String> includePatterns) {
            this.includePatterns = includePatterns;
        }

        public String getStripPrefix() {
            return stripPrefix;
        }

        public void setStripPrefix(String stripPrefix) {
            this.stripPrefix = stripPrefix;
        }
    }
}
