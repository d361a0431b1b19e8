package com.appetite.kitchen.service.cache;

import com.appetite.kitchen.model.domain.Ticket;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Canonical id to ticket map plus its station and status indexes.
 *
 * Every stored id is present in exactly one station bucket and one status bucket,
 * matching the ticket's codes at its last {@link #put}. The store records those codes
 * next to the ticket, so replacing an entry always clears the buckets it was actually
 * indexed under, even when the caller mutated the cached instance in place.
 *
 * Not thread-safe: {@link TicketStateCache} owns the only instance and guards it with
 * its read/write lock.
 */
class TicketStore {

    private final Map<UUID, Entry> entries = new HashMap<>();
    private final TicketIndex byStation = new TicketIndex();
    private final TicketIndex byStatus = new TicketIndex();

    Optional<Ticket> get(UUID id) {
        Entry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.ticket());
    }

    /**
     * Status code the ticket was last indexed under, if it is stored.
     */
    Optional<String> indexedStatus(UUID id) {
        Entry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.status());
    }

    /**
     * Inserts or replaces a ticket.
     *
     * @return the entry previously stored under the same id, if any
     */
    Optional<Entry> put(Ticket ticket) {
        UUID id = ticket.getId();
        Entry previous = entries.remove(id);
        if (previous != null) {
            byStation.remove(previous.station(), id);
            byStatus.remove(previous.status(), id);
        }
        Entry entry = new Entry(ticket, ticket.getStation(), ticket.getStatus());
        entries.put(id, entry);
        byStation.add(entry.station(), id);
        byStatus.add(entry.status(), id);
        return Optional.ofNullable(previous);
    }

    Optional<Ticket> delete(UUID id) {
        Entry removed = entries.remove(id);
        if (removed == null) {
            return Optional.empty();
        }
        byStation.remove(removed.station(), id);
        byStatus.remove(removed.status(), id);
        return Optional.of(removed.ticket());
    }

    /**
     * Deletes every ticket whose indexed status matches.
     *
     * @return number of tickets removed
     */
    int removeIfStatus(Predicate<String> statusPredicate) {
        List<UUID> doomed = entries.values().stream()
                .filter(entry -> statusPredicate.test(entry.status()))
                .map(entry -> entry.ticket().getId())
                .toList();
        doomed.forEach(this::delete);
        return doomed.size();
    }

    List<Ticket> all() {
        List<Ticket> result = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            result.add(entry.ticket());
        }
        return result;
    }

    List<Ticket> byStation(String station) {
        return resolve(byStation.get(station));
    }

    List<Ticket> byStatus(String status) {
        return resolve(byStatus.get(status));
    }

    /**
     * Walks the station bucket and keeps tickets whose status matches. Cheaper to
     * maintain than a joint station/status index.
     */
    List<Ticket> byStationAndStatus(String station, String status) {
        List<Ticket> result = new ArrayList<>();
        for (UUID id : byStation.get(station)) {
            Entry entry = entries.get(id);
            if (entry != null && Objects.equals(entry.status(), status)) {
                result.add(entry.ticket());
            }
        }
        return result;
    }

    int size() {
        return entries.size();
    }

    Map<String, Integer> stationCounts() {
        return counts(byStation);
    }

    Map<String, Integer> statusCounts() {
        return counts(byStatus);
    }

    boolean isIndexedUnderStation(String station, UUID id) {
        return byStation.contains(station, id);
    }

    boolean isIndexedUnderStatus(String status, UUID id) {
        return byStatus.contains(status, id);
    }

    Iterable<String> stationKeys() {
        return byStation.keys();
    }

    Iterable<String> statusKeys() {
        return byStatus.keys();
    }

    private List<Ticket> resolve(List<UUID> ids) {
        List<Ticket> result = new ArrayList<>(ids.size());
        for (UUID id : ids) {
            Entry entry = entries.get(id);
            if (entry != null) {
                result.add(entry.ticket());
            }
        }
        return result;
    }

    private static Map<String, Integer> counts(TicketIndex index) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String key : index.keys()) {
            counts.put(key, index.size(key));
        }
        return counts;
    }

    /**
     * A stored ticket with the codes it is indexed under.
     */
    record Entry(Ticket ticket, String station, String status) {
    }
}
