package com.appetite.kitchen.client;

import com.appetite.kitchen.model.dto.TicketCreatedEvent;
import com.appetite.kitchen.model.dto.TicketStatusChangedEvent;

/**
 * Publishes ticket events to the durable ticket log so other services, and the next
 * cache warm-up, can observe them.
 */
public interface TicketEventPublisher {

    void publishCreated(TicketCreatedEvent event);

    void publishStatusChanged(TicketStatusChangedEvent event);
}
