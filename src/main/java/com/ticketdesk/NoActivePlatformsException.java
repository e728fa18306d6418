package com.ticketdesk;

/** Every platform came back empty this cycle; there is nothing to aggregate. */
public class NoActivePlatformsException extends IllegalStateException {
    public NoActivePlatformsException(String message) {
        super(message);
    }
}
