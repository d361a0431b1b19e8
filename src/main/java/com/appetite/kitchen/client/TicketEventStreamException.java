package com.appetite.kitchen.client;

/**
 * Raised when the ticket event log cannot be read.
 */
public class TicketEventStreamException extends Exception {

    public TicketEventStreamException(String message) {
        super(message);
    }

    public TicketEventStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
