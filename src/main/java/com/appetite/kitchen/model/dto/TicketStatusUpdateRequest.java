package com.appetite.kitchen.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code PATCH /api/tickets/{id}/status}.
 */
public record TicketStatusUpdateRequest(
        @JsonProperty("status") String status,
        @JsonProperty("notes") String notes,
        @JsonProperty("reason_code_id") String reasonCodeId) {
}
