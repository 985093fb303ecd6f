package com.example.gateway.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Outcome of a request that was routed to an upstream, reported back by the caller.
 */
public class OutcomeReport {

    private String leaseId;

    @NotBlank
    private String upstream;

    private boolean success;

    @Min(0)
    private long latencyMs;

    public OutcomeReport() {
    }

    public OutcomeReport(String leaseId, String upstream, boolean success, long latencyMs) {
        this.leaseId = leaseId;
        this.upstream = upstream;
        this.success = success;
        this.latencyMs = latencyMs;
    }

    public String getLeaseId() {
        return leaseId;
    }

    public void setLeaseId(String leaseId) {
        this.leaseId = leaseId;
    }

    public String getUpstream() {
        return upstream;
    }

    public void setUpstream(String upstream) {
        this.upstream = upstream;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public void setLatencyMs(long latencyMs) {
        this.latencyMs = latencyMs;
    }
}
