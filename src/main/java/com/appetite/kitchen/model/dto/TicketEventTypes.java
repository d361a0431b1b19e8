package com.appetite.kitchen.model.dto;

/**
 * Event type discriminants and topic names shared by producers and consumers of ticket events.
 */
public final class TicketEventTypes {

    public static final String TICKET_CREATED = "kitchen.ticket.created";
    public static final String TICKET_STATUS_CHANGED = "kitchen.ticket.status_changed";

    public static final String ORDER_ITEM_CREATED = "order.item.created";
    public static final String ORDER_ITEM_UPDATED = "order.item.updated";
    public static final String ORDER_ITEM_CANCELLED = "order.item.cancelled";
    public static final String ORDER_ITEM_STATUS_CHANGED = "order.item.status_changed";

    private TicketEventTypes() {
    }
}
