package com.appetite.kitchen.service.stream;

import com.appetite.kitchen.config.KitchenProperties;
import com.appetite.kitchen.model.dto.TicketStreamEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fans ticket notifications out to every live subscriber.
 *
 * Delivery never blocks: each subscriber owns a bounded buffer and an event that does
 * not fit is dropped for that subscriber only. The registry has its own read/write lock,
 * independent of the ticket cache lock; broadcasts take the read lock so they run
 * concurrently with each other and only exclude (de)registration.
 */
@Slf4j
@Component
public class TicketEventBroadcaster {

    private final int bufferSize;
    private final Counter deliveredCounter;
    private final Counter droppedCounter;

    private final Map<String, TicketSubscription> subscribers = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();

    public TicketEventBroadcaster(KitchenProperties properties, MeterRegistry meterRegistry) {
        this.bufferSize = properties.getStream().getBufferSize();
        this.deliveredCounter = meterRegistry.counter("kitchen.stream.events.delivered");
        this.droppedCounter = meterRegistry.counter("kitchen.stream.events.dropped");
    }

    /**
     * Registers a new subscriber.
     *
     * @param stationFilter station code to receive, or null/empty for every station
     */
    public TicketSubscription subscribe(String stationFilter) {
        String id = UUID.randomUUID() + "-" + sequence.incrementAndGet();
        TicketSubscription subscription = new TicketSubscription(
                id, stationFilter, new ArrayBlockingQueue<>(bufferSize), this);

        lock.writeLock().lock();
        try {
            subscribers.put(id, subscription);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Stream subscriber {} registered (station={})", id, stationFilter == null ? "*" : stationFilter);
        return subscription;
    }

    /**
     * Offers the event to every subscriber without blocking.
     */
    public void broadcast(TicketStreamEvent event) {
        if (event == null) {
            return;
        }
        lock.readLock().lock();
        try {
            for (TicketSubscription subscription : subscribers.values()) {
                if (subscription.offer(event)) {
                    deliveredCounter.increment();
                } else {
                    droppedCounter.increment();
                    log.debug("Subscriber {} buffer full, dropping {} for ticket {}",
                            subscription.getId(), event.getEventType(), event.getTicketId());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    public int subscriberCount() {
        lock.readLock().lock();
        try {
            return subscribers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    void deregister(TicketSubscription subscription) {
        lock.writeLock().lock();
        try {
            subscribers.remove(subscription.getId());
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Stream subscriber {} deregistered", subscription.getId());
    }
}
