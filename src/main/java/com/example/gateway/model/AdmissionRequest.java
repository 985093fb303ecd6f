package com.example.gateway.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * One admission request as received from a business endpoint handler.
 */
public class AdmissionRequest {

    @NotBlank
    private String principalId;

    @NotBlank
    private String resource;

    @Valid
    private RequestContext requestContext;

    /**
     * Units consumed from the quota, 1 when omitted.
     */
    @Min(1)
    private Integer cost;

    public AdmissionRequest() {
    }

    public AdmissionRequest(String principalId, String resource, RequestContext requestContext, Integer cost) {
        this.principalId = principalId;
        this.resource = resource;
        this.requestContext = requestContext;
        this.cost = cost;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public void setPrincipalId(String principalId) {
        this.principalId = principalId;
    }

    public String getResource() {
        return resource;
    }

    public void setResource(String resource) {
        this.resource = resource;
    }

    public RequestContext getRequestContext() {
        return requestContext;
    }

    public void setRequestContext(RequestContext requestContext) {
        this.requestContext = requestContext;
    }

    public Integer getCost() {
        return cost;
    }

    public void setCost(Integer cost) {
        this.cost = cost;
    }

    public RequestContext effectiveContext() {
        return requestContext != null ? requestContext : RequestContext.empty();
    }

    public long effectiveCost() {
        return cost != null ? cost : 1L;
    }
}
