package com.ticketdesk;

public class RelayStoreException extends RuntimeException {
    public RelayStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
