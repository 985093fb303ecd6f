package com.example.gateway.filter;

import com.example.gateway.config.GatewayProperties;
import com.example.gateway.model.AdmissionDecision;
import com.example.gateway.model.AdmissionRequest;
import com.example.gateway.model.OutcomeReport;
import com.example.gateway.model.RequestContext;
import com.example.gateway.service.GatewayOrchestrator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;

/**
 * Servlet filter that runs admission for business handlers hosted in this process.
 * <p>
 * Decisions come from {@link GatewayOrchestrator}; the filter maps a denial to 403, 429 or 503 and
 * reports the handler's outcome back so the lease is released and the upstream sampled.
 */
@Component
public class AdmissionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AdmissionFilter.class);

    static final String PRINCIPAL_HEADER = "X-Principal-Id";
    static final String EVENT_ID_HEADER = "X-Event-Id";
    static final String EVENT_DATE_HEADER = "X-Event-Date";
    static final String URGENCY_HEADER = "X-Urgency";
    static final String COST_HEADER = "X-Request-Cost";

    public static final String UPSTREAM_ATTRIBUTE = AdmissionFilter.class.getName() + ".upstream";

    private static final AntPathMatcher MATCHER = new AntPathMatcher();

    private final GatewayOrchestrator orchestrator;
    private final GatewayProperties properties;
    private final Clock clock;

    public AdmissionFilter(GatewayOrchestrator orchestrator, GatewayProperties properties, Clock clock) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = pathOf(request);
        return properties.getFilter().getIncludePatterns().stream().noneMatch(p -> MATCHER.match(p, path));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String principalId = request.getHeader(PRINCIPAL_HEADER);
        if (principalId == null || principalId.isBlank()) {
            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.getWriter().write("Missing " + PRINCIPAL_HEADER);
            return;
        }

        AdmissionRequest admission = new AdmissionRequest(
                principalId,
                resourceOf(request),
                new RequestContext(
                        request.getHeader(EVENT_ID_HEADER),
                        request.getHeader(EVENT_DATE_HEADER),
                        request.getHeader(URGENCY_HEADER)),
                parseCost(request.getHeader(COST_HEADER)));

        AdmissionDecision decision = orchestrator.admit(admission);
        response.setHeader("X-Priority-Class", decision.getPriorityClass().name());
        if (decision.getRemainingQuota() != null) {
            response.setHeader("X-RateLimit-Remaining", Long.toString(decision.getRemainingQuota()));
        }

        if (decision.isAllowed()) {
            response.setHeader("X-Upstream-Target", decision.getUpstreamTarget());
            if (decision.isDegraded()) {
                response.setHeader("X-Admission-Degraded", "true");
            }
            request.setAttribute(UPSTREAM_ATTRIBUTE, decision.getUpstreamTarget());
            long started = clock.millis();
            boolean success = false;
            try {
                filterChain.doFilter(request, response);
                success = response.getStatus() < 500;
            } finally {
                orchestrator.complete(new OutcomeReport(
                        decision.getLeaseId(), decision.getUpstreamTarget(), success, clock.millis() - started));
            }
            return;
        }

        if (decision.getRetryAfterSeconds() != null) {
            response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(decision.getRetryAfterSeconds()));
        }
        switch (decision.getReason()) {
            case QUOTA_EXCEEDED:
                // Standard 429 semantics when the principal has exhausted its window.
                response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
                response.getWriter().write("Too Many Requests");
                return;
            case UNKNOWN_PRINCIPAL:
                response.setStatus(HttpStatus.FORBIDDEN.value());
                response.getWriter().write("Forbidden");
                return;
            default:
                // Store, upstream and configuration failures all surface as unavailability.
                log.warn("Rejecting {} {} for {}: {} ({})", request.getMethod(), request.getRequestURI(),
                        principalId, decision.getReason(), decision.getDetail());
                response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
                response.getWriter().write("Service temporarily unavailable (" + decision.getReason().getWireName() + ")");
        }
    }

    private static String pathOf(HttpServletRequest request) {
        return request.getRequestURI().substring(request.getContextPath().length());
    }

    private String resourceOf(HttpServletRequest request) {
        String path = pathOf(request);
        String prefix = properties.getFilter().getStripPrefix();
        if (prefix != null && !prefix.isEmpty() && path.startsWith(prefix)) {
            String stripped = path.substring(prefix.length());
            return stripped.isEmpty() ? "/" : stripped;
        }
        return path;
    }

    private Integer parseCost(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            int cost = Integer.parseInt(header.trim());
            return cost >= 1 ? cost : null;
        } catch (NumberFormatException ex) {
            log.debug("Ignoring malformed {} header '{}'", COST_HEADER, header);
            return null;
        }
    }
}
