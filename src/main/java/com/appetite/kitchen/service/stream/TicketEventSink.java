package com.appetite.kitchen.service.stream;

import com.appetite.kitchen.model.dto.TicketStreamEvent;

import java.io.IOException;

/**
 * Destination of a single subscriber's events, typically an SSE connection.
 */
@FunctionalInterface
public interface TicketEventSink {

    /**
     * @throws IOException when the client is gone; the stream ends and the subscription is released
     */
    void send(TicketStreamEvent event) throws IOException;

    /**
     * Keep-alive written while the subscriber is idle. Sinks backed by a network
     * connection override this so a vanished client is detected without event traffic.
     *
     * @throws IOException when the client is gone
     */
    default void heartbeat() throws IOException {
    }
}
