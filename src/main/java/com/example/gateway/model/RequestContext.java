package com.example.gateway.model;

import jakarta.validation.constraints.Size;

/**
 * Context a caller declares for one request. Nothing here is trusted until the classifier verifies it.
 */
public class RequestContext {

    @Size(max = 128)
    private String eventId;

    /**
     * ISO-8601 local date of the event, e.g. {@code 2026-06-20}.
     */
    @Size(max = 32)
    private String eventDate;

    @Size(max = 32)
    private String declaredUrgency;

    public RequestContext() {
    }

    public RequestContext(String eventId, String eventDate, String declaredUrgency) {
        this.eventId = eventId;
        this.eventDate = eventDate;
        this.declaredUrgency = declaredUrgency;
    }

    public static RequestContext empty() {
        return new RequestContext();
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getEventDate() {
        return eventDate;
    }

    public void setEventDate(String eventDate) {
        this.eventDate = eventDate;
    }

    public String getDeclaredUrgency() {
        return declaredUrgency;
    }

    public void setDeclaredUrgency(String declaredUrgency) {
        this.declaredUrgency = declaredUrgency;
    }
}
