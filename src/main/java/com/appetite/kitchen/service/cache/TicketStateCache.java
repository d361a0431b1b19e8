package com.appetite.kitchen.service.cache;

import com.appetite.kitchen.model.domain.KitchenStatus;
import com.appetite.kitchen.model.domain.Ticket;
import com.appetite.kitchen.model.dto.CacheStats;
import com.appetite.kitchen.model.dto.TicketStreamEvent;
import com.appetite.kitchen.service.stream.TicketEventBroadcaster;
import com.appetite.kitchen.service.stream.TicketStreamEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory, indexed projection of kitchen tickets.
 *
 * All reads take the read lock and all writes take the write lock of a single
 * {@link ReentrantReadWriteLock}. Notifications produced by a write are collected while
 * the lock is held and handed to the {@link TicketEventBroadcaster} only after it has
 * been released, so the cache lock and the subscriber registry lock are never nested.
 *
 * Query results are point-in-time lists; the tickets in them are never mutated by the
 * cache afterwards, updates always store a fresh instance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketStateCache {

    private final TicketEventApplier applier;
    private final TicketEventBroadcaster broadcaster;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final TicketStore store = new TicketStore();

    // ---------------------------------------------------------------------
    // Mutation gateway
    // ---------------------------------------------------------------------

    /**
     * Inserts or replaces a ticket and notifies subscribers of its current status.
     * A {@code null} ticket is ignored.
     */
    public void set(Ticket ticket) {
        if (ticket == null) {
            return;
        }
        if (ticket.getId() == null) {
            log.warn("Ignoring ticket without id: {}", ticket);
            return;
        }

        Ticket stored = ticket.copy();
        String previousStatus;
        lock.writeLock().lock();
        try {
            previousStatus = store.put(stored).map(TicketStore.Entry::status).orElse(null);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Cached ticket {} ({} -> {})", stored.getId(), previousStatus, stored.getStatus());
        broadcaster.broadcast(TicketStreamEvents.statusChanged(stored, previousStatus));
    }

    /**
     * Deletes a ticket from the cache. Subscribers are not notified.
     */
    public void remove(UUID id) {
        if (id == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            store.delete(id).ifPresent(removed -> log.debug("Evicted ticket {}", id));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies one raw ticket event, broadcasting the resulting notification if any.
     */
    public void apply(byte[] data) {
        Optional<TicketStreamEvent> notification;
        lock.writeLock().lock();
        try {
            notification = applier.apply(store, data);
        } finally {
            lock.writeLock().unlock();
        }
        notification.ifPresent(broadcaster::broadcast);
    }

    // ---------------------------------------------------------------------
    // Bootstrap helpers
    // ---------------------------------------------------------------------

    /**
     * Applies an ordered batch of raw events holding the write lock once for the whole
     * batch. Notifications are broadcast in order after the lock is released.
     *
     * @return number of tickets cached after the replay
     */
    public int replay(List<byte[]> events) {
        List<TicketStreamEvent> outbox = new ArrayList<>();
        int size;
        lock.writeLock().lock();
        try {
            for (byte[] event : events) {
                applier.apply(store, event).ifPresent(outbox::add);
            }
            size = store.size();
        } finally {
            lock.writeLock().unlock();
        }

        outbox.forEach(broadcaster::broadcast);
        return size;
    }

    /**
     * Loads tickets from a repository scan under a single write lock, without
     * notifying subscribers.
     *
     * @return number of tickets cached after the load
     */
    public int load(Collection<Ticket> tickets) {
        lock.writeLock().lock();
        try {
            for (Ticket ticket : tickets) {
                if (ticket == null || ticket.getId() == null) {
                    log.warn("Skipping ticket without id during load: {}", ticket);
                    continue;
                }
                store.put(ticket.copy());
            }
            return store.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops every ticket in a terminal status.
     *
     * @return number of tickets removed
     */
    public int pruneTerminal() {
        lock.writeLock().lock();
        try {
            return store.removeIfStatus(KitchenStatus::isTerminalCode);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Swaps the whole cache contents for the given tickets under one write lock, so
     * readers never observe a partially reloaded cache. Subscribers are not notified.
     *
     * @return number of tickets cached after the swap
     */
    public int replaceAll(Collection<Ticket> tickets) {
        lock.writeLock().lock();
        try {
            store.removeIfStatus(status -> true);
            return load(tickets);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public Optional<Ticket> get(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return store.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Ticket> getAll() {
        lock.readLock().lock();
        try {
            return store.all();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Ticket> getByStationCode(String station) {
        lock.readLock().lock();
        try {
            return store.byStation(station);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Ticket> getByStatusCode(String status) {
        lock.readLock().lock();
        try {
            return store.byStatus(status);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Ticket> getByStationAndStatusCode(String station, String status) {
        lock.readLock().lock();
        try {
            return store.byStationAndStatus(station, status);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats stats() {
        int subscribers = broadcaster.subscriberCount();
        lock.readLock().lock();
        try {
            return new CacheStats(store.size(), store.stationCounts(), store.statusCounts(), subscribers);
        } finally {
            lock.readLock().unlock();
        }
    }
}
