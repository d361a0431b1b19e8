package com.appetite.kitchen.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;

/**
 * Fields common to every event published on the kitchen tickets topic.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TicketEventMetadata {
    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("occurred_at")
    private Instant occurredAt;

    @JsonProperty("ticket_id")
    private String ticketId;

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("order_item_id")
    private String orderItemId;

    @JsonProperty("menu_item_id")
    private String menuItemId;

    @JsonProperty("station")
    private String station;

    @JsonProperty("menu_item_name")
    private String menuItemName;

    @JsonProperty("station_name")
    private String stationName;

    @JsonProperty("table_number")
    private String tableNumber;
}
