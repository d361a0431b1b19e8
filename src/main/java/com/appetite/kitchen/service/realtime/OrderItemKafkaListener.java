package com.appetite.kitchen.service.realtime;

import com.appetite.kitchen.model.dto.OrderItemEvent;
import com.appetite.kitchen.model.dto.TicketEventTypes;
import com.appetite.kitchen.service.ticket.TicketService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.annotation.RetryableTopic;
import org.springframework.retry.annotation.Backoff;
import org.springframework.stereotype.Service;

/**
 * Turns order item changes that need station production into kitchen tickets.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "kitchen.kafka.enabled", havingValue = "true")
public class OrderItemKafkaListener {
    private final TicketService ticketService;
    private final ObjectMapper objectMapper;

    @RetryableTopic(attempts = "3", backoff = @Backoff(delay = 1000, multiplier = 2))
    @KafkaListener(topics = "${kitchen.kafka.topics.order-items}", groupId = "${kitchen.kafka.group-id}")
    public void consumeOrderItem(String payload) {
        OrderItemEvent event;
        try {
            event = objectMapper.readValue(payload, OrderItemEvent.class);
        } catch (JsonProcessingException e) {
            // Unparseable payloads would fail every retry the same way
            log.error("Dropping malformed order item event: {}", e.getMessage());
            return;
        }

        if (!event.isRequiresProduction()) {
            log.debug("Order item {} needs no production, skipping", event.getOrderItemId());
            return;
        }

        log.info("Received {} for order item {}", event.getEventType(), event.getOrderItemId());
        try {
            dispatch(event);
        } catch (Exception e) {
            log.error("Fatal error processing {} for order item {}: ", event.getEventType(), event.getOrderItemId(), e);
            throw e; // retried, then dead-lettered
        }
    }

    void dispatch(OrderItemEvent event) {
        String eventType = event.getEventType();
        if (eventType == null) {
            log.warn("Order item event without type for order item {}", event.getOrderItemId());
            return;
        }
        switch (eventType) {
            case TicketEventTypes.ORDER_ITEM_CREATED -> ticketService.createFromOrderItem(event);
            case TicketEventTypes.ORDER_ITEM_UPDATED -> ticketService.updateFromOrderItem(event);
            case TicketEventTypes.ORDER_ITEM_CANCELLED -> ticketService.cancelFromOrderItem(event);
            case TicketEventTypes.ORDER_ITEM_STATUS_CHANGED -> ticketService.applyOrderItemStatus(event);
            default -> log.info("Ignoring order item event of unknown type '{}'", eventType);
        }
    }
}
