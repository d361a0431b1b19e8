package com.appetite.kitchen.service.ticket;

/**
 * Raised when a requested status change is not allowed from the ticket's current status.
 */
public class InvalidTicketTransitionException extends RuntimeException {

    public InvalidTicketTransitionException(String message) {
        super(message);
    }
}
