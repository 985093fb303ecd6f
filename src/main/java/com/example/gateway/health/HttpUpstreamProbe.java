package com.example.gateway.health;

import com.example.gateway.model.UpstreamService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Probes an upstream with GET on its health URL. Any 2xx answer within the timeout is a success.
 */
@Component
public class HttpUpstreamProbe implements UpstreamProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamProbe.class);

    private final RestTemplate restTemplate;
    private final Clock clock;

    public HttpUpstreamProbe(@Qualifier("probeRestTemplate") RestTemplate restTemplate, Clock clock) {
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    @Override
    public HealthSample probe(UpstreamService upstream) {
        long started = clock.millis();
        boolean success;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(upstream.getHealthUrl(), String.class);
            success = response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException ex) {
            // Non-2xx statuses, timeouts and refused connections all land here.
            log.debug("Health probe of {} failed: {}", upstream.getId(), ex.getMessage());
            success = false;
        }
        long latency = clock.millis() - started;
        return new HealthSample(upstream.getId(), success, latency, clock.instant(), HealthSample.Source.PROBE);
    }
}
