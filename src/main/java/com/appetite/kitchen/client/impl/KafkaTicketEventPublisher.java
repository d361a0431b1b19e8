package com.appetite.kitchen.client.impl;

import com.appetite.kitchen.client.TicketEventPublisher;
import com.appetite.kitchen.config.KitchenProperties;
import com.appetite.kitchen.model.dto.TicketCreatedEvent;
import com.appetite.kitchen.model.dto.TicketEventMetadata;
import com.appetite.kitchen.model.dto.TicketStatusChangedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes ticket events as JSON to the tickets topic, keyed by ticket id.
 *
 * Publishing is fire-and-forget: the ticket is already persisted and cached when an
 * event is sent, so send failures are logged rather than propagated.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "kitchen.kafka.enabled", havingValue = "true")
public class KafkaTicketEventPublisher implements TicketEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public KafkaTicketEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                     ObjectMapper objectMapper,
                                     KitchenProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = properties.getKafka().getTopics().getTickets();
    }

    @Override
    public void publishCreated(TicketCreatedEvent event) {
        send(event);
    }

    @Override
    public void publishStatusChanged(TicketStatusChangedEvent event) {
        send(event);
    }

    private void send(TicketEventMetadata event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for ticket {}", event.getEventType(), event.getTicketId(), e);
            return;
        }

        kafkaTemplate.send(topic, event.getTicketId(), payload).whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("❌ Failed to publish {} for ticket {}", event.getEventType(), event.getTicketId(), ex);
            } else {
                log.debug("Published {} for ticket {} at offset {}", event.getEventType(), event.getTicketId(),
                        result.getRecordMetadata().offset());
            }
        });
    }
}
