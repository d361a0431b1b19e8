package com.appetite.kitchen.client.impl;

import com.appetite.kitchen.client.TicketEventStreamException;
import com.appetite.kitchen.config.KitchenProperties;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.ConsumerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("KafkaTicketEventStream Tests")
class KafkaTicketEventStreamTest {

    private static final String TOPIC = "kitchen.tickets";

    @Mock
    private ConsumerFactory<String, byte[]> consumerFactory;

    private MockConsumer<String, byte[]> consumer;
    private KafkaTicketEventStream eventStream;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        KitchenProperties properties = new KitchenProperties();
        properties.getCache().setReplayPollTimeout(Duration.ofMillis(50));
        eventStream = new KafkaTicketEventStream(consumerFactory, properties);
    }

    private void givenTopicWithRecords(int partitions, int recordsPerPartition) {
        Node node = new Node(0, "localhost", 9092);
        List<PartitionInfo> infos = new ArrayList<>();
        Map<TopicPartition, Long> beginning = new HashMap<>();
        for (int p = 0; p < partitions; p++) {
            infos.add(new PartitionInfo(TOPIC, p, node, new Node[]{node}, new Node[]{node}));
            beginning.put(new TopicPartition(TOPIC, p), 0L);
        }
        consumer.updatePartitions(TOPIC, infos);
        consumer.updateBeginningOffsets(beginning);

        // Records can only be added once partitions are assigned, which happens inside fetch
        consumer.schedulePollTask(() -> {
            for (int p = 0; p < partitions; p++) {
                for (int offset = 0; offset < recordsPerPartition; offset++) {
                    consumer.addRecord(new ConsumerRecord<>(TOPIC, p, offset, "ticket-" + p,
                            ("p" + p + "-" + offset).getBytes(StandardCharsets.UTF_8)));
                }
            }
        });
    }

    @Test
    @DisplayName("Should read every partition from the beginning until the log is drained")
    void shouldReadAllPartitions() throws Exception {
        when(consumerFactory.createConsumer()).thenReturn(consumer);
        givenTopicWithRecords(2, 3);

        List<byte[]> events = eventStream.fetch(100);

        assertThat(events).hasSize(6);
        assertThat(events).extracting(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .containsSubsequence("p0-0", "p0-1", "p0-2")
                .containsSubsequence("p1-0", "p1-1", "p1-2");
        assertThat(consumer.closed()).isTrue();
    }

    @Test
    @DisplayName("Should stop at the requested maximum")
    void shouldStopAtMaxCount() throws Exception {
        when(consumerFactory.createConsumer()).thenReturn(consumer);
        givenTopicWithRecords(1, 10);

        assertThat(eventStream.fetch(4)).hasSize(4);
    }

    @Test
    @DisplayName("Should fail when the topic does not exist")
    void shouldFailForMissingTopic() {
        when(consumerFactory.createConsumer()).thenReturn(consumer);

        assertThatThrownBy(() -> eventStream.fetch(10))
                .isInstanceOf(TicketEventStreamException.class)
                .hasMessageContaining(TOPIC);
    }

    @Test
    @DisplayName("Should wrap Kafka failures")
    void shouldWrapKafkaFailures() {
        when(consumerFactory.createConsumer()).thenReturn(consumer);
        givenTopicWithRecords(1, 1);
        consumer.setPollException(new KafkaException("broker unreachable"));

        assertThatThrownBy(() -> eventStream.fetch(10))
                .isInstanceOf(TicketEventStreamException.class)
                .hasCauseInstanceOf(KafkaException.class);
    }
}
