package com.example.gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    /**
     * Fails startup when the rule, upstream or route configuration is malformed.
     */
    @Bean
    public GatewayCatalog gatewayCatalog(GatewayProperties properties) {
        return GatewayCatalog.from(properties);
    }

    /**
     * UTC clock behind every time-based decision in the gateway.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Client used by the active health prober. Timeouts bound every probe.
     */
    @Bean
    public RestTemplate probeRestTemplate(RestTemplateBuilder builder, GatewayProperties properties) {
        return builder
                .setConnectTimeout(properties.getHealth().getProbeTimeout())
                .setReadTimeout(properties.getHealth().getProbeTimeout())
                .build();
    }
}
