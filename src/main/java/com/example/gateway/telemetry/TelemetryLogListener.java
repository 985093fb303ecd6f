package com.example.gateway.telemetry;

import com.example.gateway.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes gateway telemetry events to a dedicated logger that alerting can tail.
 */
@Component
public class TelemetryLogListener {

    private static final Logger log = LoggerFactory.getLogger("gateway.telemetry");

    @EventListener
    public void onCircuitTransition(CircuitTransitionEvent event) {
        if (event.getTo() == CircuitState.OPEN) {
            log.warn("circuit upstream={} from={} to={} at={} cause={}",
                    event.getUpstreamId(), event.getFrom(), event.getTo(), event.getAt(), event.getCause());
        } else {
            log.info("circuit upstream={} from={} to={} at={} cause={}",
                    event.getUpstreamId(), event.getFrom(), event.getTo(), event.getAt(), event.getCause());
        }
    }

    @EventListener
    public void onFailMode(FailModeEvent event) {
        log.error("fail-{} principal={} rule={} at={} cause={}",
                event.getMode().name().toLowerCase(), event.getPrincipalId(), event.getRuleName(),
                event.getAt(), event.getCause());
    }
}
