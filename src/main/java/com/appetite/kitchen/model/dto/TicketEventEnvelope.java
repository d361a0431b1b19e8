package com.appetite.kitchen.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Minimal view of a ticket event, decoded first to pick the typed payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TicketEventEnvelope(
        @JsonProperty("event_type") String eventType) {
}
