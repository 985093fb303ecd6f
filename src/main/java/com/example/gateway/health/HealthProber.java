package com.example.gateway.health;

import com.example.gateway.config.GatewayCatalog;
import com.example.gateway.model.UpstreamService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Periodic producer of health samples. Upstreams without a health URL rely on passive samples only.
 */
@Component
public class HealthProber {

    private static final Logger log = LoggerFactory.getLogger(HealthProber.class);

    private final GatewayCatalog catalog;
    private final UpstreamProbe probe;
    private final HealthMonitor monitor;

    public HealthProber(GatewayCatalog catalog, UpstreamProbe probe, HealthMonitor monitor) {
        this.catalog = catalog;
        this.probe = probe;
        this.monitor = monitor;
    }

    public void probeAll() {
        for (UpstreamService upstream : catalog.getUpstreams()) {
            if (upstream.getHealthUrl() == null || upstream.getHealthUrl().isBlank()) {
                continue;
            }
            try {
                monitor.submit(probe.probe(upstream));
            } catch (RuntimeException ex) {
                // A broken probe must not stop the others from running.
                log.error("Health probe of {} threw unexpectedly", upstream.getId(), ex);
            }
        }
    }
}
