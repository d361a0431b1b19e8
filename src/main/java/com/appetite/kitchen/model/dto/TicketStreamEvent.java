package com.appetite.kitchen.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Change notification pushed to live ticket stream subscribers.
 *
 * This is the wire envelope seen by stream clients. Fields may be added but never
 * renamed or removed; absent values are omitted and unknown fields are ignored on read
 * so older and newer clients keep interoperating.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TicketStreamEvent {
    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    @JsonProperty("ticket_id")
    String ticketId;

    @JsonProperty("order_id")
    String orderId;

    @JsonProperty("order_item_id")
    String orderItemId;

    @JsonProperty("menu_item_id")
    String menuItemId;

    @JsonProperty("station")
    String station;

    @JsonProperty("menu_item_name")
    String menuItemName;

    @JsonProperty("station_name")
    String stationName;

    @JsonProperty("table_number")
    String tableNumber;

    @JsonProperty("new_status")
    String newStatus;

    @JsonProperty("previous_status")
    String previousStatus;

    @JsonProperty("quantity")
    Integer quantity;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("reason_code_id")
    String reasonCodeId;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("finished_at")
    Instant finishedAt;

    @JsonProperty("delivered_at")
    Instant deliveredAt;
}
