package com.example.gateway.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An authenticated caller of the gateway: a vendor, an internal service or an administrative actor.
 */
public final class Principal {

    private final String id;
    private final Tier tier;
    private final List<RateLimitRule> rules;
    private final Set<String> eventBindings;

    public Principal(String id, Tier tier, List<RateLimitRule> rules, Set<String> eventBindings) {
        this.id = Objects.requireNonNull(id, "id");
        this.tier = Objects.requireNonNull(tier, "tier");
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.eventBindings = eventBindings == null ? Set.of() : Set.copyOf(eventBindings);
    }

    public String getId() {
        return id;
    }

    public Tier getTier() {
        return tier;
    }

    /**
     * Principal-specific rules. These take precedence over the tier template.
     */
    public List<RateLimitRule> getRules() {
        return rules;
    }

    /**
     * Live events this principal is bound to. Empty means the principal is not restricted to specific events.
     */
    public Set<String> getEventBindings() {
        return eventBindings;
    }

    @Override
    public String toString() {
        return "Principal[" + id + ", " + tier + "]";
    }
}
