package com.appetite.kitchen.client.impl;

import com.appetite.kitchen.client.TicketEventPublisher;
import com.appetite.kitchen.model.dto.TicketCreatedEvent;
import com.appetite.kitchen.model.dto.TicketStatusChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stand-in publisher used when Kafka is disabled, e.g. local runs and tests.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "kitchen.kafka.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingTicketEventPublisher implements TicketEventPublisher {

    @Override
    public void publishCreated(TicketCreatedEvent event) {
        log.info("🎭 [KAFKA DISABLED] Would publish {} for ticket {} (station={})",
                event.getEventType(), event.getTicketId(), event.getStation());
    }

    @Override
    public void publishStatusChanged(TicketStatusChangedEvent event) {
        log.info("🎭 [KAFKA DISABLED] Would publish {} for ticket {} ({} -> {})",
                event.getEventType(), event.getTicketId(), event.getPreviousStatus(), event.getNewStatus());
    }
}
