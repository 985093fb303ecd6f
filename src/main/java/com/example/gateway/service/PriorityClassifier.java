package com.example.gateway.service;

import com.example.gateway.config.GatewayCatalog;
import com.example.gateway.config.GatewayProperties;
import com.example.gateway.exception.InvalidContextException;
import com.example.gateway.model.Classification;
import com.example.gateway.model.EmergencyOverride;
import com.example.gateway.model.PriorityClass;
import com.example.gateway.model.Principal;
import com.example.gateway.model.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Derives a request's priority class from the principal's tier, its declared event context and
 * any emergency override in scope.
 * <p>
 * Classification has no side effects and, for a given clock reading and override set, always
 * yields the same class. Event claims are never trusted blindly: a missing, malformed or
 * non-matching date leaves the request at its tier's class, and a principal bound to specific
 * events can only claim those. Overrides scoped to an event only apply to verified claims.
 */
@Service
public class PriorityClassifier {

    private static final Logger log = LoggerFactory.getLogger(PriorityClassifier.class);

    static final String CRITICAL_URGENCY = "critical";

    private final GatewayCatalog catalog;
    private final EmergencyOverrideRegistry overrides;
    private final GatewayProperties properties;
    private final Clock clock;

    public PriorityClassifier(
            GatewayCatalog catalog,
            EmergencyOverrideRegistry overrides,
            GatewayProperties properties,
            Clock clock
    ) {
        this.catalog = catalog;
        this.overrides = overrides;
        this.properties = properties;
        this.clock = clock;
    }

    public PriorityClass classify(Principal principal, RequestContext context) {
        return evaluate(principal, context).getPriorityClass();
    }

    /**
     * Classifies the request and reports the quota adjustments it earns.
     */
    public Classification evaluate(Principal principal, RequestContext context) {
        RequestContext ctx = context != null ? context : RequestContext.empty();

        PriorityClass floor = catalog.baseClassOf(principal.getTier());

        boolean claimable = mayClaimEvent(principal, ctx.getEventId());
        boolean eventDay = claimable && isToday(principal, ctx);
        if (eventDay) {
            floor = PriorityClass.max(floor, PriorityClass.HIGH);
            if (CRITICAL_URGENCY.equalsIgnoreCase(trimToNull(ctx.getDeclaredUrgency()))) {
                floor = PriorityClass.CRITICAL;
            }
        }

        // Event-scoped overrides need a verified claim: today's event, or an explicit binding.
        String claimedId = trimToNull(ctx.getEventId());
        boolean verifiedClaim = claimedId != null
                && (eventDay || principal.getEventBindings().contains(claimedId));
        List<EmergencyOverride> inScope = overrides.activeFor(principal.getId(), verifiedClaim ? claimedId : null);

        PriorityClass ceiling = null;
        double multiplier = 1.0;
        for (EmergencyOverride override : inScope) {
            switch (override.getEffect()) {
                case PRIORITY_FLOOR:
                    floor = PriorityClass.max(floor, override.getPriorityClass());
                    break;
                case PRIORITY_CEILING:
                    ceiling = ceiling == null ? override.getPriorityClass() : PriorityClass.min(ceiling, override.getPriorityClass());
                    break;
                case QUOTA_MULTIPLIER:
                    multiplier = Math.max(multiplier, override.getFactor());
                    break;
                default:
                    break;
            }
        }

        PriorityClass result = ceiling != null ? PriorityClass.min(floor, ceiling) : floor;
        return new Classification(result, eventDay, multiplier);
    }

    private boolean isToday(Principal principal, RequestContext ctx) {
        String rawDate = trimToNull(ctx.getEventDate());
        if (rawDate == null) {
            return false;
        }
        LocalDate eventDate;
        try {
            eventDate = parseEventDate(rawDate);
        } catch (InvalidContextException ex) {
            log.warn("Ignoring event claim of {}: {}", principal.getId(), ex.getMessage());
            return false;
        }
        return eventDate.equals(LocalDate.now(clock.withZone(properties.getZoneId())));
    }

    private boolean mayClaimEvent(Principal principal, String eventId) {
        if (principal.getEventBindings().isEmpty()) {
            return true;
        }
        String id = trimToNull(eventId);
        if (id == null || !principal.getEventBindings().contains(id)) {
            log.debug("Principal {} claimed event {} it is not bound to", principal.getId(), eventId);
            return false;
        }
        return true;
    }

    static LocalDate parseEventDate(String rawDate) throws InvalidContextException {
        try {
            return LocalDate.parse(rawDate);
        } catch (DateTimeParseException ex) {
            throw new InvalidContextException("malformed eventDate '" + rawDate + "'", ex);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
