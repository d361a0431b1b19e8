package com.appetite.kitchen.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Order item change published by the order service on the order items topic.
 * Only items that require production at a station become kitchen tickets.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrderItemEvent {
    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("order_item_id")
    private String orderItemId;

    @JsonProperty("menu_item_id")
    private String menuItemId;

    @JsonProperty("menu_item_name")
    private String menuItemName;

    @JsonProperty("quantity")
    private int quantity;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("status")
    private String status;

    @JsonProperty("requires_production")
    private boolean requiresProduction;

    @JsonProperty("production_station")
    private String productionStation;

    @JsonProperty("station_name")
    private String stationName;

    @JsonProperty("table_number")
    private String tableNumber;
}
