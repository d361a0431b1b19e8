package com.appetite.kitchen.service.stream;

import com.appetite.kitchen.model.domain.Ticket;
import com.appetite.kitchen.model.dto.TicketEventTypes;
import com.appetite.kitchen.model.dto.TicketStreamEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Builds stream notifications from cached tickets and decoded ticket events.
 */
public final class TicketStreamEvents {

    private TicketStreamEvents() {
    }

    /**
     * Synthetic created notification used for the initial snapshot of a new subscriber.
     */
    public static TicketStreamEvent created(Ticket ticket) {
        return base(ticket)
                .eventType(TicketEventTypes.TICKET_CREATED)
                .occurredAt(ticket.getCreatedAt())
                .build();
    }

    public static TicketStreamEvent statusChanged(Ticket ticket, String previousStatus) {
        return base(ticket)
                .eventType(TicketEventTypes.TICKET_STATUS_CHANGED)
                .occurredAt(ticket.getUpdatedAt() != null ? ticket.getUpdatedAt() : Instant.now())
                .previousStatus(previousStatus)
                .build();
    }

    private static TicketStreamEvent.TicketStreamEventBuilder base(Ticket ticket) {
        return TicketStreamEvent.builder()
                .ticketId(asString(ticket.getId()))
                .orderId(asString(ticket.getOrderId()))
                .orderItemId(asString(ticket.getOrderItemId()))
                .menuItemId(asString(ticket.getMenuItemId()))
                .station(ticket.getStation())
                .menuItemName(ticket.getMenuItemName())
                .stationName(ticket.getStationName())
                .tableNumber(ticket.getTableNumber())
                .newStatus(ticket.getStatus())
                .quantity(ticket.getQuantity())
                .notes(ticket.getNotes())
                .reasonCodeId(asString(ticket.getReasonCodeId()))
                .startedAt(ticket.getStartedAt())
                .finishedAt(ticket.getFinishedAt())
                .deliveredAt(ticket.getDeliveredAt());
    }

    private static String asString(UUID id) {
        return id == null ? null : id.toString();
    }
}
