package com.example.gateway.service;

import com.example.gateway.config.GatewayCatalog;
import com.example.gateway.exception.ConfigurationMissingException;
import com.example.gateway.health.HealthMonitor;
import com.example.gateway.model.AdmissionDecision;
import com.example.gateway.model.AdmissionRequest;
import com.example.gateway.model.Classification;
import com.example.gateway.model.DenialReason;
import com.example.gateway.model.OutcomeReport;
import com.example.gateway.model.PriorityClass;
import com.example.gateway.model.Principal;
import com.example.gateway.model.QuotaResult;
import com.example.gateway.model.RateLimitRule;
import com.example.gateway.model.RouteDefinition;
import org.slf4j.Logger;
import com.example.gateway.telemetry.FailMode;
import com.example.gateway.telemetry.FailModeEvent;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Per-request entry point: classify, consume quota, route, and answer with one
 * {@link AdmissionDecision}.
 * <p>
 * Holds no state between requests; everything lives in the components it calls. Internal errors
 * never reach the caller: they become a structured denial, or, for requests classified
 * {@link PriorityClass#CRITICAL}, a degraded admission.
 */
@Service
public class GatewayOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GatewayOrchestrator.class);

    private static final long DEFAULT_RETRY_AFTER_SECONDS = 1L;

    private final GatewayCatalog catalog;
    private final PriorityClassifier classifier;
    private final QuotaLedger ledger;
    private final RoutingEngine routingEngine;
    private final HealthMonitor healthMonitor;
    private final Clock clock;
    private final ApplicationEventPublisher events;

    public GatewayOrchestrator(
            GatewayCatalog catalog,
            PriorityClassifier classifier,
            QuotaLedger ledger,
            RoutingEngine routingEngine,
            HealthMonitor healthMonitor,
            Clock clock,
            ApplicationEventPublisher events
    ) {
        this.catalog = catalog;
        this.classifier = classifier;
        this.ledger = ledger;
        this.routingEngine = routingEngine;
        this.healthMonitor = healthMonitor;
        this.clock = clock;
        this.events = events;
    }

    public AdmissionDecision admit(AdmissionRequest request) {
        Optional<Principal> found = catalog.findPrincipal(request.getPrincipalId());
        if (found.isEmpty()) {
            log.warn("Rejecting request from unknown principal {} for {}", request.getPrincipalId(), request.getResource());
            return AdmissionDecision.deny(PriorityClass.LOW, DenialReason.UNKNOWN_PRINCIPAL,
                    "principal is not provisioned");
        }
        Principal principal = found.get();
        String resource = request.getResource();
        PriorityClass priorityClass = catalog.baseClassOf(principal.getTier());

        try {
            Classification classification = classifier.evaluate(principal, request.effectiveContext());
            priorityClass = classification.getPriorityClass();

            RateLimitRule rule = catalog.resolveRule(principal, resource)
                    .orElseThrow(() -> new ConfigurationMissingException(principal.getId(), resource, "rate-limit rule"));
            RouteDefinition route = catalog.resolveRoute(resource)
                    .orElseThrow(() -> new ConfigurationMissingException(principal.getId(), resource, "route"));

            QuotaResult quota = ledger.checkAndConsume(
                    principal,
                    rule,
                    request.effectiveCost(),
                    classification.quotaMultiplierFor(rule),
                    classification.isEventDay(),
                    priorityClass);

            switch (quota.getDecision()) {
                case REJECT_QUOTA_EXCEEDED:
                    return AdmissionDecision.deny(priorityClass, DenialReason.QUOTA_EXCEEDED,
                            "quota of rule " + rule.getName() + " exhausted", retryAfterSeconds(quota))
                            .withQuota(quota);
                case REJECT_STORE_FAILURE:
                    return AdmissionDecision.deny(priorityClass, DenialReason.STORE_UNAVAILABLE,
                            "quota could not be verified", DEFAULT_RETRY_AFTER_SECONDS);
                case ALLOW:
                default:
                    break;
            }

            RouteResult routed = routingEngine.route(priorityClass, route);
            if (!routed.isRouted()) {
                return AdmissionDecision.deny(priorityClass, DenialReason.UPSTREAM_UNAVAILABLE,
                        routed.getRejection(), DEFAULT_RETRY_AFTER_SECONDS);
            }
            AdmissionDecision decision = AdmissionDecision.allow(
                    priorityClass,
                    routed.getTarget(),
                    routed.isDegraded() || quota.isDegraded(),
                    routed.getLease().getId())
                    .withQuota(quota);
            log.debug("Admitted {} for {}: {}", principal.getId(), resource, decision);
            return decision;
        } catch (ConfigurationMissingException ex) {
            log.error("Configuration missing, operator attention required: {}", ex.getMessage());
            return AdmissionDecision.deny(priorityClass, DenialReason.CONFIGURATION_MISSING, ex.getMessage());
        } catch (RuntimeException ex) {
            return handleUnexpected(principal, resource, priorityClass, ex);
        }
    }

    /**
     * Takes a caller's outcome report: frees the lease and feeds a passive health sample.
     */
    public void complete(OutcomeReport report) {
        Optional<UpstreamLease> lease = routingEngine.release(report.getLeaseId());
        String upstream = lease.map(UpstreamLease::getUpstreamId).orElse(report.getUpstream());
        boolean probe = lease.map(UpstreamLease::isProbe).orElse(false);
        healthMonitor.recordOutcome(upstream, report.isSuccess(), report.getLatencyMs(), probe);
    }

    private AdmissionDecision handleUnexpected(
            Principal principal,
            String resource,
            PriorityClass priorityClass,
            RuntimeException ex
    ) {
        if (priorityClass == PriorityClass.CRITICAL) {
            Optional<String> target = catalog.resolveRoute(resource).map(route ->
                    route.getFallback() != null ? route.getFallback() : route.getUpstreams().get(0));
            if (target.isPresent()) {
                log.error("Unexpected error admitting critical request of {} for {}; admitting degraded to {}",
                        principal.getId(), resource, target.get(), ex);
                publishFailMode(principal, resource, FailMode.OPEN, ex);
                return AdmissionDecision.allow(priorityClass, target.get(), true, null);
            }
        }
        log.error("Unexpected error admitting {} for {}; failing closed", principal.getId(), resource, ex);
        publishFailMode(principal, resource, FailMode.CLOSED, ex);
        return AdmissionDecision.deny(priorityClass, DenialReason.INTERNAL_ERROR, "internal error");
    }

    private void publishFailMode(Principal principal, String resource, FailMode mode, RuntimeException cause) {
        String ruleName = catalog.resolveRule(principal, resource).map(RateLimitRule::getName).orElse(resource);
        events.publishEvent(new FailModeEvent(principal.getId(), ruleName, mode, clock.instant(), String.valueOf(cause)));
    }

    private long retryAfterSeconds(QuotaResult quota) {
        long millis = Duration.between(clock.instant(), quota.getResetAt()).toMillis();
        return Math.max(1L, (millis + 999L) / 1000L);
    }
}
