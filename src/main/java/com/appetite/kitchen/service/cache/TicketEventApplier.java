package com.appetite.kitchen.service.cache;

import com.appetite.kitchen.model.domain.Ticket;
import com.appetite.kitchen.model.dto.TicketCreatedEvent;
import com.appetite.kitchen.model.dto.TicketEventEnvelope;
import com.appetite.kitchen.model.dto.TicketEventMetadata;
import com.appetite.kitchen.model.dto.TicketEventTypes;
import com.appetite.kitchen.model.dto.TicketStatusChangedEvent;
import com.appetite.kitchen.model.dto.TicketStreamEvent;
import com.appetite.kitchen.service.stream.TicketStreamEvents;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Decodes raw ticket events and applies them to a {@link TicketStore}.
 *
 * Decoding is two-step: a minimal envelope yields the event type, then the payload is
 * read into the typed event for that type. Unknown types are ignored and malformed
 * payloads are logged and dropped; nothing is ever thrown back to the caller.
 *
 * Callers must hold the cache write lock. The applier never broadcasts itself; it
 * returns the notification so the cache can publish it after releasing the lock.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketEventApplier {

    private final ObjectMapper objectMapper;

    /**
     * Applies one raw event.
     *
     * @return the notification to broadcast, present only for status changes
     */
    Optional<TicketStreamEvent> apply(TicketStore store, byte[] data) {
        if (data == null || data.length == 0) {
            log.warn("Dropping empty ticket event");
            return Optional.empty();
        }

        TicketEventEnvelope envelope;
        try {
            envelope = objectMapper.readValue(data, TicketEventEnvelope.class);
        } catch (IOException e) {
            log.warn("Dropping unparseable ticket event: {}", e.getMessage());
            return Optional.empty();
        }

        String eventType = envelope.eventType();
        if (TicketEventTypes.TICKET_CREATED.equals(eventType)) {
            applyCreated(store, data);
            return Optional.empty();
        }
        if (TicketEventTypes.TICKET_STATUS_CHANGED.equals(eventType)) {
            return applyStatusChanged(store, data);
        }

        log.debug("Ignoring ticket event of unknown type '{}'", eventType);
        return Optional.empty();
    }

    private void applyCreated(TicketStore store, byte[] data) {
        TicketCreatedEvent event;
        try {
            event = objectMapper.readValue(data, TicketCreatedEvent.class);
        } catch (IOException e) {
            log.warn("Dropping malformed {} event: {}", TicketEventTypes.TICKET_CREATED, e.getMessage());
            return;
        }

        UUID ticketId = parseId(event.getTicketId());
        if (ticketId == null) {
            log.warn("Dropping {} event without a valid ticket id: '{}'", TicketEventTypes.TICKET_CREATED, event.getTicketId());
            return;
        }

        Ticket ticket = new Ticket(ticketId, event.getStation(), event.getStatus());
        copyLinkage(event, ticket);
        ticket.setQuantity(event.getQuantity());
        ticket.setNotes(event.getNotes());
        ticket.setCreatedAt(event.getOccurredAt());
        ticket.setUpdatedAt(event.getOccurredAt());

        // A created event always wins, including over an entry synthesized from an earlier status change
        store.put(ticket);
        log.debug("Applied ticket created: id={} station={} status={}", ticketId, ticket.getStation(), ticket.getStatus());
    }

    private Optional<TicketStreamEvent> applyStatusChanged(TicketStore store, byte[] data) {
        TicketStatusChangedEvent event;
        try {
            event = objectMapper.readValue(data, TicketStatusChangedEvent.class);
        } catch (IOException e) {
            log.warn("Dropping malformed {} event: {}", TicketEventTypes.TICKET_STATUS_CHANGED, e.getMessage());
            return Optional.empty();
        }

        UUID ticketId = parseId(event.getTicketId());
        if (ticketId == null) {
            log.warn("Dropping {} event without a valid ticket id: '{}'", TicketEventTypes.TICKET_STATUS_CHANGED, event.getTicketId());
            return Optional.empty();
        }

        Optional<Ticket> existing = store.get(ticketId);
        Ticket ticket;
        if (existing.isPresent()) {
            ticket = existing.get().copy();
        } else {
            // Status change seen before its creation: keep a minimal entry so lookups still find it
            log.debug("Synthesizing ticket {} from out-of-order status change", ticketId);
            ticket = new Ticket(ticketId, event.getStation(), event.getNewStatus());
            copyLinkage(event, ticket);
            ticket.setCreatedAt(event.getOccurredAt());
        }
        String previousStatus = store.indexedStatus(ticketId).orElse(null);

        ticket.setStatus(event.getNewStatus());
        ticket.setUpdatedAt(event.getOccurredAt());
        if (event.getNotes() != null) {
            ticket.setNotes(event.getNotes());
        }
        if (event.getStartedAt() != null) {
            ticket.setStartedAt(event.getStartedAt());
        }
        if (event.getFinishedAt() != null) {
            ticket.setFinishedAt(event.getFinishedAt());
        }
        if (event.getDeliveredAt() != null) {
            ticket.setDeliveredAt(event.getDeliveredAt());
        }
        UUID reasonCodeId = parseId(event.getReasonCodeId());
        if (reasonCodeId != null) {
            ticket.setReasonCodeId(reasonCodeId);
        }

        store.put(ticket);
        log.debug("Applied ticket status change: id={} {} -> {}", ticketId, previousStatus, ticket.getStatus());

        String reportedPrevious = event.getPreviousStatus() != null ? event.getPreviousStatus() : previousStatus;
        return Optional.of(TicketStreamEvents.statusChanged(ticket, reportedPrevious));
    }

    private static void copyLinkage(TicketEventMetadata event, Ticket ticket) {
        ticket.setOrderId(parseId(event.getOrderId()));
        ticket.setOrderItemId(parseId(event.getOrderItemId()));
        ticket.setMenuItemId(parseId(event.getMenuItemId()));
        ticket.setMenuItemName(event.getMenuItemName());
        ticket.setStationName(event.getStationName());
        ticket.setTableNumber(event.getTableNumber());
    }

    private static UUID parseId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring invalid UUID '{}'", value);
            return null;
        }
    }
}
