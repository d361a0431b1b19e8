package com.appetite.kitchen.controller;

import com.appetite.kitchen.model.domain.Ticket;
import com.appetite.kitchen.model.dto.TicketStatusUpdateRequest;
import com.appetite.kitchen.service.cache.TicketStateCache;
import com.appetite.kitchen.service.ticket.TicketNotFoundException;
import com.appetite.kitchen.service.ticket.TicketService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketStateCache ticketStateCache;
    private final TicketService ticketService;

    /**
     * Lists tickets. Station and status filters are served from the cache; order and
     * order item filters go to the repository.
     */
    @GetMapping
    public ResponseEntity<Map<String, List<Ticket>>> listTickets(
            @RequestParam(required = false) String station,
            @RequestParam(required = false) String status,
            @RequestParam(name = "order_id", required = false) UUID orderId,
            @RequestParam(name = "order_item_id", required = false) UUID orderItemId) {
        List<Ticket> tickets;
        if (orderItemId != null) {
            tickets = ticketService.findByOrderItem(orderItemId).map(List::of).orElse(List.of());
        } else if (orderId != null) {
            tickets = ticketService.findByOrder(orderId);
        } else if (hasText(station) && hasText(status)) {
            tickets = ticketStateCache.getByStationAndStatusCode(station, status);
        } else if (hasText(station)) {
            tickets = ticketStateCache.getByStationCode(station);
        } else if (hasText(status)) {
            tickets = ticketStateCache.getByStatusCode(status);
        } else {
            tickets = ticketStateCache.getAll();
        }
        return ResponseEntity.ok(Map.of("tickets", tickets));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Ticket> getTicket(@PathVariable UUID id) {
        Ticket ticket = ticketService.findTicket(id).orElseThrow(() -> new TicketNotFoundException(id));
        return ResponseEntity.ok(ticket);
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<Ticket> updateStatus(@PathVariable UUID id, @RequestBody TicketStatusUpdateRequest request) {
        log.info("Status change requested for ticket {}: {}", id, request.status());
        UUID reasonCodeId = hasText(request.reasonCodeId()) ? UUID.fromString(request.reasonCodeId()) : null;
        Ticket updated = ticketService.changeStatus(id, request.status(), request.notes(), reasonCodeId);
        return ResponseEntity.ok(updated);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
