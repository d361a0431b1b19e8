package com.appetite.kitchen.service.stream;

import com.appetite.kitchen.config.KitchenProperties;
import com.appetite.kitchen.model.domain.Ticket;
import com.appetite.kitchen.model.dto.TicketStreamEvent;
import com.appetite.kitchen.service.cache.TicketStateCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Streams ticket changes to one subscriber: a snapshot of the current cache followed by
 * live notifications.
 *
 * The subscription is registered before the snapshot is read, so a change made while the
 * snapshot is being sent is queued rather than lost. A subscriber may therefore see a
 * ticket in the snapshot and again as a live change; clients treat events as upserts.
 *
 * While no event reaches the subscriber a heartbeat is written every
 * {@code kitchen.stream.heartbeat-interval}, so a client that disconnected is released
 * even when its station sees no traffic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketStreamService {

    private final TicketStateCache cache;
    private final TicketEventBroadcaster broadcaster;
    private final KitchenProperties properties;

    /**
     * Runs on the calling thread until it is interrupted or the sink fails.
     *
     * @param stationFilter station code, or null/empty for every station
     */
    public void stream(String stationFilter, TicketEventSink sink) {
        try (TicketSubscription subscription = broadcaster.subscribe(stationFilter)) {
            sendSnapshot(stationFilter, subscription, sink);

            Duration heartbeatInterval = properties.getStream().getHeartbeatInterval();
            long lastWrite = System.nanoTime();
            while (!Thread.currentThread().isInterrupted()) {
                TicketStreamEvent event = subscription.next(heartbeatInterval);
                if (event != null && subscription.matches(event)) {
                    sink.send(event);
                    lastWrite = System.nanoTime();
                } else if (System.nanoTime() - lastWrite >= heartbeatInterval.toNanos()) {
                    sink.heartbeat();
                    lastWrite = System.nanoTime();
                }
            }
        } catch (InterruptedException e) {
            log.debug("Ticket stream for station={} cancelled", stationFilter);
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.info("Ticket stream client for station={} went away: {}", stationFilter, e.getMessage());
        }
    }

    private void sendSnapshot(String stationFilter, TicketSubscription subscription, TicketEventSink sink)
            throws IOException {
        List<Ticket> snapshot = (stationFilter == null || stationFilter.isEmpty())
                ? cache.getAll()
                : cache.getByStationCode(stationFilter);
        log.debug("Sending snapshot of {} tickets to subscriber {}", snapshot.size(), subscription.getId());
        for (Ticket ticket : snapshot) {
            sink.send(TicketStreamEvents.created(ticket));
        }
    }
}
