package com.appetite.kitchen.service.bootstrap;

/**
 * Outcome of a cache warm-up: where the tickets came from and how many were cached.
 */
public record WarmResult(Source source, int tickets) {

    public enum Source {
        /** Replayed from the ticket event log. */
        STREAM,
        /** Loaded from a repository scan. */
        REPOSITORY,
        /** Neither source was usable; the cache starts empty. */
        NONE
    }

    public static WarmResult none() {
        return new WarmResult(Source.NONE, 0);
    }
}
