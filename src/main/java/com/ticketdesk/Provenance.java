package com.ticketdesk;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Whether a platform's numbers were scraped by us or submitted through the relay. */
public enum Provenance {
    DIRECT, RELAY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Provenance fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
