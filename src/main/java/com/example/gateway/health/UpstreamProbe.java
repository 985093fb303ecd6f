package com.example.gateway.health;

import com.example.gateway.model.UpstreamService;

/**
 * Actively checks one upstream. Implementations must return within the configured probe timeout.
 */
public interface UpstreamProbe {

    HealthSample probe(UpstreamService upstream);
}
