package com.ticketdesk;

public class RelayValidationException extends IllegalArgumentException {
    public RelayValidationException(String message) {
        super(message);
    }
}
