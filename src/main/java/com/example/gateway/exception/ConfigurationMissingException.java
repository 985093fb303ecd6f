package com.example.gateway.exception;

/**
 * No rate-limit rule or route resolves for a resource. This is an operator error, never "unlimited".
 */
public class ConfigurationMissingException extends RuntimeException {

    private final String principalId;
    private final String resource;

    public ConfigurationMissingException(String principalId, String resource, String what) {
        super("No " + what + " configured for resource " + resource + " (principal " + principalId + ")");
        this.principalId = principalId;
        this.resource = resource;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getResource() {
        return resource;
    }
}
