package com.appetite.kitchen.model.dto;

import java.util.Map;

/**
 * Snapshot of ticket cache occupancy for the internal endpoints.
 */
public record CacheStats(
        int tickets,
        Map<String, Integer> byStation,
        Map<String, Integer> byStatus,
        int subscribers) {
}
