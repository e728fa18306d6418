package com.ticketdesk;

/** Position of a strategy in a platform's fallback chain. */
public enum ScrapeStage {
    PRIMARY, SECONDARY, RELAY
}
