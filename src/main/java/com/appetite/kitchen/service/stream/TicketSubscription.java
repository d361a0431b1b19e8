package com.appetite.kitchen.service.stream;

import com.appetite.kitchen.model.dto.TicketStreamEvent;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live subscriber of the {@link TicketEventBroadcaster}.
 *
 * Events are buffered in a bounded queue filled by the broadcaster and drained by the
 * subscriber's own thread. Use in try-with-resources so the subscription is always
 * deregistered; {@link #close()} is idempotent.
 */
public class TicketSubscription implements AutoCloseable {

    private final String id;
    private final String stationFilter;
    private final BlockingQueue<TicketStreamEvent> queue;
    private final TicketEventBroadcaster broadcaster;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    TicketSubscription(String id, String stationFilter, BlockingQueue<TicketStreamEvent> queue,
                       TicketEventBroadcaster broadcaster) {
        this.id = id;
        this.stationFilter = stationFilter;
        this.queue = queue;
        this.broadcaster = broadcaster;
    }

    public String getId() {
        return id;
    }

    /**
     * Blocks until the next event is available.
     *
     * @throws InterruptedException when the subscriber's thread is cancelled
     */
    public TicketStreamEvent next() throws InterruptedException {
        return queue.take();
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the event, or null when none arrived in time
     * @throws InterruptedException when the subscriber's thread is cancelled
     */
    public TicketStreamEvent next(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Whether an event is of interest to this subscriber. An empty filter matches all stations.
     */
    public boolean matches(TicketStreamEvent event) {
        if (stationFilter == null || stationFilter.isEmpty()) {
            return true;
        }
        return stationFilter.equals(event.getStation());
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Number of buffered events not yet taken.
     */
    public int pending() {
        return queue.size();
    }

    // Non-blocking; false when the buffer is full
    boolean offer(TicketStreamEvent event) {
        return queue.offer(event);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            broadcaster.deregister(this);
            queue.clear();
        }
    }
}
