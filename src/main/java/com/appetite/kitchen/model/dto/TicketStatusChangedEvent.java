package com.appetite.kitchen.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Instant;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TicketStatusChangedEvent extends TicketEventMetadata {
    @JsonProperty("new_status")
    private String newStatus;

    @JsonProperty("previous_status")
    private String previousStatus;

    @JsonProperty("reason_code_id")
    private String reasonCodeId;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("finished_at")
    private Instant finishedAt;

    @JsonProperty("delivered_at")
    private Instant deliveredAt;
}
