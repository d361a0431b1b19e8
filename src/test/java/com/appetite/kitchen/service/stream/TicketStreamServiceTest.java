package com.appetite.kitchen.service.stream;

import com.appetite.kitchen.config.KitchenProperties;
import com.appetite.kitchen.model.domain.Ticket;
import com.appetite.kitchen.model.dto.TicketEventTypes;
import com.appetite.kitchen.model.dto.TicketStreamEvent;
import com.appetite.kitchen.service.cache.TicketStateCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TicketStreamService Tests")
class TicketStreamServiceTest {

    @Mock
    private TicketStateCache cache;

    private TicketEventBroadcaster broadcaster;
    private TicketStreamService streamService;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        KitchenProperties properties = new KitchenProperties();
        properties.getStream().setHeartbeatInterval(Duration.ofMillis(50));
        broadcaster = new TicketEventBroadcaster(properties, new SimpleMeterRegistry());
        streamService = new TicketStreamService(cache, broadcaster, properties);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should send the snapshot as created events, then live changes for the station")
    void shouldSendSnapshotThenLive() throws Exception {
        UUID kitchenTicket = UUID.randomUUID();
        when(cache.getByStationCode("kitchen")).thenReturn(List.of(new Ticket(kitchenTicket, "kitchen", "started")));
        BlockingQueue<TicketStreamEvent> received = new LinkedBlockingQueue<>();

        Future<?> stream = executor.submit(() -> streamService.stream("kitchen", received::add));

        TicketStreamEvent snapshot = received.poll(2, TimeUnit.SECONDS);
        assertThat(snapshot).isNotNull();
        assertThat(snapshot.getEventType()).isEqualTo(TicketEventTypes.TICKET_CREATED);
        assertThat(snapshot.getTicketId()).isEqualTo(kitchenTicket.toString());
        assertThat(broadcaster.subscriberCount()).isEqualTo(1);

        broadcaster.broadcast(change("bar"));
        broadcaster.broadcast(change("kitchen"));

        TicketStreamEvent live = received.poll(2, TimeUnit.SECONDS);
        assertThat(live).isNotNull();
        assertThat(live.getStation()).isEqualTo("kitchen");
        assertThat(live.getEventType()).isEqualTo(TicketEventTypes.TICKET_STATUS_CHANGED);

        stream.cancel(true);
        awaitNoSubscribers();
        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("Should stream every station when no filter is given")
    void shouldStreamAllStations() throws Exception {
        when(cache.getAll()).thenReturn(List.of(
                new Ticket(UUID.randomUUID(), "kitchen", "created"),
                new Ticket(UUID.randomUUID(), "bar", "created")));
        BlockingQueue<TicketStreamEvent> received = new LinkedBlockingQueue<>();

        Future<?> stream = executor.submit(() -> streamService.stream(null, received::add));

        assertThat(received.poll(2, TimeUnit.SECONDS)).isNotNull();
        assertThat(received.poll(2, TimeUnit.SECONDS)).isNotNull();
        broadcaster.broadcast(change("dessert"));
        assertThat(received.poll(2, TimeUnit.SECONDS)).extracting(TicketStreamEvent::getStation).isEqualTo("dessert");

        stream.cancel(true);
        awaitNoSubscribers();
    }

    @Test
    @DisplayName("Should release the subscription when the sink fails")
    void shouldReleaseOnSinkFailure() throws Exception {
        when(cache.getAll()).thenReturn(List.of());

        Future<?> stream = executor.submit(() -> streamService.stream(null, event -> {
            throw new IOException("client went away");
        }));
        awaitSubscribers(1);

        broadcaster.broadcast(change("kitchen"));

        stream.get(2, TimeUnit.SECONDS);
        assertThat(broadcaster.subscriberCount()).isZero();
    }

    @Test
    @DisplayName("Should release a filtered subscriber whose client is gone even without matching traffic")
    void shouldReleaseIdleFilteredSubscriberOnHeartbeatFailure() throws Exception {
        when(cache.getByStationCode("kitchen")).thenReturn(List.of());
        TicketEventSink goneClient = new TicketEventSink() {
            @Override
            public void send(TicketStreamEvent event) throws IOException {
                throw new IOException("client gone");
            }

            @Override
            public void heartbeat() throws IOException {
                throw new IOException("client gone");
            }
        };

        Future<?> stream = executor.submit(() -> streamService.stream("kitchen", goneClient));
        awaitSubscribers(1);
        for (int i = 0; i < 500; i++) {
            broadcaster.broadcast(change("bar"));
        }

        stream.get(2, TimeUnit.SECONDS);
        assertThat(stream.isDone()).isTrue();
        assertThat(broadcaster.subscriberCount()).isZero();
    }

    @Test
    @DisplayName("Should write heartbeats while the subscriber is idle")
    void shouldHeartbeatWhenIdle() throws Exception {
        when(cache.getAll()).thenReturn(List.of());
        CountDownLatch heartbeats = new CountDownLatch(2);
        TicketEventSink sink = new TicketEventSink() {
            @Override
            public void send(TicketStreamEvent event) {
            }

            @Override
            public void heartbeat() {
                heartbeats.countDown();
            }
        };

        Future<?> stream = executor.submit(() -> streamService.stream(null, sink));

        assertThat(heartbeats.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(broadcaster.subscriberCount()).isEqualTo(1);

        stream.cancel(true);
        awaitNoSubscribers();
    }

    private void awaitSubscribers(int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (broadcaster.subscriberCount() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(broadcaster.subscriberCount()).isEqualTo(expected);
    }

    private void awaitNoSubscribers() throws InterruptedException {
        awaitSubscribers(0);
    }

    private static TicketStreamEvent change(String station) {
        return TicketStreamEvent.builder()
                .eventType(TicketEventTypes.TICKET_STATUS_CHANGED)
                .ticketId(UUID.randomUUID().toString())
                .station(station)
                .previousStatus("created")
                .newStatus("started")
                .build();
    }
}
