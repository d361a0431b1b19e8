package com.appetite.kitchen.service.realtime;

import com.appetite.kitchen.service.cache.TicketStateCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Applies ticket events written by other instances to this instance's cache.
 *
 * Each instance listens in its own group so every instance sees every event. Events this
 * instance published itself are applied again, leaving the ticket unchanged and
 * re-broadcasting an equivalent notification. Malformed events are dropped by the cache,
 * so nothing here is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = {"kitchen.kafka.enabled", "kitchen.kafka.live-apply"}, havingValue = "true")
public class TicketEventKafkaListener {
    private final TicketStateCache ticketStateCache;

    @KafkaListener(topics = "${kitchen.kafka.topics.tickets}",
            groupId = "${kitchen.kafka.group-id}-live-${random.uuid}",
            properties = {
                    "value.deserializer=org.apache.kafka.common.serialization.ByteArrayDeserializer",
                    "auto.offset.reset=latest"
            })
    public void consumeTicketEvent(byte[] payload) {
        log.debug("Received ticket event ({} bytes)", payload == null ? 0 : payload.length);
        ticketStateCache.apply(payload);
    }
}
