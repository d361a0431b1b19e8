package com.appetite.kitchen.service.ticket;

import com.appetite.kitchen.client.TicketEventPublisher;
import com.appetite.kitchen.model.domain.KitchenStatus;
import com.appetite.kitchen.model.domain.Station;
import com.appetite.kitchen.model.domain.Ticket;
import com.appetite.kitchen.model.dto.OrderItemEvent;
import com.appetite.kitchen.model.dto.TicketCreatedEvent;
import com.appetite.kitchen.model.dto.TicketEventMetadata;
import com.appetite.kitchen.model.dto.TicketEventTypes;
import com.appetite.kitchen.model.dto.TicketStatusChangedEvent;
import com.appetite.kitchen.repository.TicketRepository;
import com.appetite.kitchen.service.cache.TicketStateCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the ticket lifecycle: every change is persisted first, then written through the
 * ticket cache, then published to the ticket event log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketService {

    private final TicketRepository ticketRepository;
    private final TicketStateCache ticketStateCache;
    private final TicketEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Cache first, repository as fallback.
     */
    public Optional<Ticket> findTicket(UUID id) {
        Optional<Ticket> cached = ticketStateCache.get(id);
        if (cached.isPresent()) {
            return cached;
        }
        return ticketRepository.findById(id);
    }

    public List<Ticket> findByOrder(UUID orderId) {
        return ticketRepository.findByOrderId(orderId);
    }

    public Optional<Ticket> findByOrderItem(UUID orderItemId) {
        return ticketRepository.findByOrderItemId(orderItemId);
    }

    /**
     * Moves a ticket to a new status on behalf of the kitchen staff.
     *
     * @throws TicketNotFoundException if the ticket does not exist
     * @throws InvalidTicketTransitionException if the ticket is already finished, or a
     *         ready ticket is marked delivered (delivery is recorded by waitstaff on the order)
     */
    @Transactional
    public Ticket changeStatus(UUID id, String newStatus, String notes, UUID reasonCodeId) {
        if (newStatus == null || newStatus.isBlank()) {
            throw new IllegalArgumentException("Status is required");
        }

        Ticket ticket = ticketRepository.findById(id).orElseThrow(() -> new TicketNotFoundException(id));
        String previousStatus = ticket.getStatus();

        if (KitchenStatus.isTerminalCode(previousStatus)) {
            throw new InvalidTicketTransitionException(
                    "Cannot modify " + previousStatus + " ticket " + id);
        }
        if (KitchenStatus.READY.code().equals(previousStatus) && KitchenStatus.DELIVERED.code().equals(newStatus)) {
            throw new InvalidTicketTransitionException(
                    "Cannot move ticket " + id + " from ready to delivered; delivery is recorded on the order");
        }

        ticket.setStatus(newStatus);
        if (notes != null) {
            ticket.setNotes(notes);
        }
        if (reasonCodeId != null) {
            ticket.setReasonCodeId(reasonCodeId);
        }
        stampMilestone(ticket, newStatus);

        Ticket saved = ticketRepository.save(ticket);
        ticketStateCache.set(saved);
        log.info("Ticket {} status {} -> {}", id, previousStatus, newStatus);

        eventPublisher.publishStatusChanged(statusChangedEvent(saved, previousStatus));
        return saved;
    }

    /**
     * Creates the ticket for a new order item. Idempotent: an order item that already
     * has a ticket is left untouched.
     */
    @Transactional
    public Optional<Ticket> createFromOrderItem(OrderItemEvent event) {
        UUID orderItemId = parseId(event.getOrderItemId(), "order_item_id");
        UUID orderId = parseId(event.getOrderId(), "order_id");
        UUID menuItemId = parseId(event.getMenuItemId(), "menu_item_id");
        if (orderItemId == null || orderId == null || menuItemId == null) {
            return Optional.empty();
        }

        Optional<Ticket> existing = ticketRepository.findByOrderItemId(orderItemId);
        if (existing.isPresent()) {
            log.debug("Ticket {} already exists for order item {}", existing.get().getId(), orderItemId);
            return Optional.empty();
        }

        Instant now = clock.instant();
        Ticket ticket = new Ticket(UUID.randomUUID(), event.getProductionStation(), KitchenStatus.CREATED.code());
        ticket.setOrderId(orderId);
        ticket.setOrderItemId(orderItemId);
        ticket.setMenuItemId(menuItemId);
        ticket.setQuantity(event.getQuantity());
        ticket.setNotes(event.getNotes());
        ticket.setMenuItemName(event.getMenuItemName());
        ticket.setStationName(event.getStationName() != null
                ? event.getStationName()
                : Station.fromCode(event.getProductionStation()).map(Station::label).orElse(null));
        ticket.setTableNumber(event.getTableNumber());
        ticket.setCreatedAt(now);
        ticket.setUpdatedAt(now);

        Ticket saved = ticketRepository.save(ticket);
        ticketStateCache.set(saved);
        log.info("Created ticket {} for order item {} at station {}", saved.getId(), orderItemId, saved.getStation());

        eventPublisher.publishCreated(createdEvent(saved));
        return Optional.of(saved);
    }

    /**
     * Copies quantity and notes of an updated order item onto its ticket.
     */
    @Transactional
    public Optional<Ticket> updateFromOrderItem(OrderItemEvent event) {
        return findForOrderItem(event).map(ticket -> {
            ticket.setQuantity(event.getQuantity());
            ticket.setNotes(event.getNotes());
            ticket.setUpdatedAt(clock.instant());

            Ticket saved = ticketRepository.save(ticket);
            ticketStateCache.set(saved);
            log.info("Updated ticket {} for order item {}", saved.getId(), event.getOrderItemId());
            return saved;
        });
    }

    @Transactional
    public Optional<Ticket> cancelFromOrderItem(OrderItemEvent event) {
        return findForOrderItem(event).map(ticket -> applyOrderStatus(ticket, KitchenStatus.CANCELLED));
    }

    /**
     * Mirrors order item status changes the kitchen cares about. Only delivery and
     * cancellation are mapped; other order statuses are ignored.
     */
    @Transactional
    public Optional<Ticket> applyOrderItemStatus(OrderItemEvent event) {
        Optional<KitchenStatus> mapped = KitchenStatus.fromCode(event.getStatus()).filter(KitchenStatus::isTerminal);
        if (mapped.isEmpty()) {
            log.info("Order item status '{}' is not mapped to a kitchen ticket status", event.getStatus());
            return Optional.empty();
        }
        return findForOrderItem(event).map(ticket -> applyOrderStatus(ticket, mapped.get()));
    }

    private Ticket applyOrderStatus(Ticket ticket, KitchenStatus status) {
        String previousStatus = ticket.getStatus();
        ticket.setStatus(status.code());
        stampMilestone(ticket, status.code());

        Ticket saved = ticketRepository.save(ticket);
        ticketStateCache.set(saved);
        log.info("Ticket {} status {} -> {} from order item", saved.getId(), previousStatus, status.code());

        eventPublisher.publishStatusChanged(statusChangedEvent(saved, previousStatus));
        return saved;
    }

    private Optional<Ticket> findForOrderItem(OrderItemEvent event) {
        UUID orderItemId = parseId(event.getOrderItemId(), "order_item_id");
        if (orderItemId == null) {
            return Optional.empty();
        }
        Optional<Ticket> ticket = ticketRepository.findByOrderItemId(orderItemId);
        if (ticket.isEmpty()) {
            log.debug("No ticket for order item {}", orderItemId);
        }
        return ticket;
    }

    // Milestones are recorded once, the first time the ticket enters the status
    private void stampMilestone(Ticket ticket, String status) {
        Instant now = clock.instant();
        ticket.setUpdatedAt(now);
        if (KitchenStatus.STARTED.code().equals(status) && ticket.getStartedAt() == null) {
            ticket.setStartedAt(now);
        } else if (KitchenStatus.READY.code().equals(status) && ticket.getFinishedAt() == null) {
            ticket.setFinishedAt(now);
        } else if (KitchenStatus.DELIVERED.code().equals(status) && ticket.getDeliveredAt() == null) {
            ticket.setDeliveredAt(now);
        }
    }

    private TicketCreatedEvent createdEvent(Ticket ticket) {
        TicketCreatedEvent event = new TicketCreatedEvent();
        fillMetadata(event, ticket, TicketEventTypes.TICKET_CREATED);
        event.setStatus(ticket.getStatus());
        event.setQuantity(ticket.getQuantity());
        event.setNotes(ticket.getNotes());
        return event;
    }

    private TicketStatusChangedEvent statusChangedEvent(Ticket ticket, String previousStatus) {
        TicketStatusChangedEvent event = new TicketStatusChangedEvent();
        fillMetadata(event, ticket, TicketEventTypes.TICKET_STATUS_CHANGED);
        event.setNewStatus(ticket.getStatus());
        event.setPreviousStatus(previousStatus);
        event.setNotes(ticket.getNotes());
        event.setQuantity(ticket.getQuantity());
        event.setStartedAt(ticket.getStartedAt());
        event.setFinishedAt(ticket.getFinishedAt());
        event.setDeliveredAt(ticket.getDeliveredAt());
        if (ticket.getReasonCodeId() != null) {
            event.setReasonCodeId(ticket.getReasonCodeId().toString());
        }
        return event;
    }

    private void fillMetadata(TicketEventMetadata event, Ticket ticket, String eventType) {
        event.setEventType(eventType);
        event.setOccurredAt(ticket.getUpdatedAt() != null ? ticket.getUpdatedAt() : clock.instant());
        event.setTicketId(ticket.getId().toString());
        event.setOrderId(asString(ticket.getOrderId()));
        event.setOrderItemId(asString(ticket.getOrderItemId()));
        event.setMenuItemId(asString(ticket.getMenuItemId()));
        event.setStation(ticket.getStation());
        event.setMenuItemName(ticket.getMenuItemName());
        event.setStationName(ticket.getStationName());
        event.setTableNumber(ticket.getTableNumber());
    }

    private static String asString(UUID id) {
        return id == null ? null : id.toString();
    }

    private static UUID parseId(String value, String field) {
        if (value == null || value.isBlank()) {
            log.warn("Missing {} on order item event", field);
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {} on order item event: '{}'", field, value);
            return null;
        }
    }
}
