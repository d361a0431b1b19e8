package com.appetite.kitchen.client.impl;

import com.appetite.kitchen.client.TicketEventStream;
import com.appetite.kitchen.client.TicketEventStreamException;
import com.appetite.kitchen.config.KitchenProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the ticket event log from the beginning of the tickets topic.
 *
 * Partitions are assigned manually, so no consumer group offsets are read or committed
 * and every warm-up sees the full retained log. Events of one ticket share a key and
 * therefore a partition, which keeps their relative order intact.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "kitchen.kafka.enabled", havingValue = "true")
public class KafkaTicketEventStream implements TicketEventStream {

    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final String topic;
    private final Duration pollTimeout;

    public KafkaTicketEventStream(@Qualifier("ticketReplayConsumerFactory") ConsumerFactory<String, byte[]> consumerFactory,
                                  KitchenProperties properties) {
        this.consumerFactory = consumerFactory;
        this.topic = properties.getKafka().getTopics().getTickets();
        this.pollTimeout = properties.getCache().getReplayPollTimeout();
    }

    @Override
    public List<byte[]> fetch(int maxCount) throws TicketEventStreamException {
        try (Consumer<String, byte[]> consumer = consumerFactory.createConsumer()) {
            List<TopicPartition> partitions = partitions(consumer);
            consumer.assign(partitions);
            consumer.seekToBeginning(partitions);

            List<byte[]> events = new ArrayList<>();
            while (events.size() < maxCount) {
                ConsumerRecords<String, byte[]> records = consumer.poll(pollTimeout);
                if (records.isEmpty()) {
                    break;
                }
                for (ConsumerRecord<String, byte[]> record : records) {
                    if (events.size() >= maxCount) {
                        break;
                    }
                    if (record.value() != null) {
                        events.add(record.value());
                    }
                }
            }

            log.info("Fetched {} events from topic '{}' across {} partitions", events.size(), topic, partitions.size());
            return events;
        } catch (KafkaException e) {
            throw new TicketEventStreamException("Failed to read ticket events from topic '" + topic + "'", e);
        }
    }

    private List<TopicPartition> partitions(Consumer<String, byte[]> consumer) throws TicketEventStreamException {
        List<PartitionInfo> infos = consumer.partitionsFor(topic, pollTimeout);
        if (infos == null || infos.isEmpty()) {
            throw new TicketEventStreamException("Topic '" + topic + "' has no partitions");
        }
        List<TopicPartition> partitions = new ArrayList<>(infos.size());
        for (PartitionInfo info : infos) {
            partitions.add(new TopicPartition(info.topic(), info.partition()));
        }
        return partitions;
    }
}
