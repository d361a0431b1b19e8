package com.appetite.kitchen.client;

import java.util.List;

/**
 * Durable log of ticket events, read once at startup to rebuild the ticket cache.
 */
public interface TicketEventStream {

    /**
     * Fetches up to {@code maxCount} historical events in log order.
     *
     * @param maxCount upper bound on the number of events returned
     * @return raw JSON payloads, oldest first; never null
     * @throws TicketEventStreamException if the log cannot be read
     */
    List<byte[]> fetch(int maxCount) throws TicketEventStreamException;
}
