package com.techportfolio.portfolio.publisher;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.techportfolio.common.event.ChangeEvent;

import java.time.Instant;

/**
 * Body posted to the audit sink for one {@link ChangeEvent}.
 */
public record AuditEnvelope(
    @JsonProperty("type")      String type,
    @JsonProperty("entityId")  Long entityId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("payload")   Object payload
) {

    public static AuditEnvelope of(ChangeEvent event) {
        return new AuditEnvelope(event.eventType(), event.entityId(), event.timestamp(), event.snapshot());
    }
}
