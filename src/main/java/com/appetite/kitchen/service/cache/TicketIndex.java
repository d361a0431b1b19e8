package com.appetite.kitchen.service.cache;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Secondary index from a categorical code (station, status) to the ids holding it.
 *
 * Buckets keep insertion order and cannot hold the same id twice. Empty buckets are
 * dropped so {@link #keys()} only reports codes that currently have tickets.
 * Not thread-safe; {@link TicketStore} is always accessed under the cache lock.
 */
class TicketIndex {

    private final Map<String, Set<UUID>> buckets = new HashMap<>();

    void add(String key, UUID id) {
        buckets.computeIfAbsent(normalize(key), k -> new LinkedHashSet<>()).add(id);
    }

    void remove(String key, UUID id) {
        String normalized = normalize(key);
        Set<UUID> bucket = buckets.get(normalized);
        if (bucket == null) {
            return;
        }
        bucket.remove(id);
        if (bucket.isEmpty()) {
            buckets.remove(normalized);
        }
    }

    List<UUID> get(String key) {
        Set<UUID> bucket = buckets.get(normalize(key));
        if (bucket == null) {
            return Collections.emptyList();
        }
        return List.copyOf(bucket);
    }

    boolean contains(String key, UUID id) {
        Set<UUID> bucket = buckets.get(normalize(key));
        return bucket != null && bucket.contains(id);
    }

    Set<String> keys() {
        return Set.copyOf(buckets.keySet());
    }

    int size(String key) {
        Set<UUID> bucket = buckets.get(normalize(key));
        return bucket == null ? 0 : bucket.size();
    }

    // Null codes are indexed under the empty code so every stored ticket has a bucket
    private static String normalize(String key) {
        return key == null ? "" : key;
    }
}
