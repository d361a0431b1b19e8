package com.appetite.kitchen.repository;

import com.appetite.kitchen.model.domain.Ticket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TicketRepository extends JpaRepository<Ticket, UUID> {

    /**
     * Finds the ticket produced for an order item, used to keep ticket creation idempotent.
     */
    Optional<Ticket> findByOrderItemId(UUID orderItemId);

    List<Ticket> findByOrderId(UUID orderId);
}
