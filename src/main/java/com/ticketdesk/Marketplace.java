package com.ticketdesk;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** The marketplaces we know how to poll, in the order a cycle visits them. */
public enum Marketplace {
    STUBHUB("stubhub"),
    SEATGEEK("seatgeek"),
    TICKPICK("tickpick"),
    VIVIDSEATS("vividseats"),
    TICKETMASTER("ticketmaster");

    private final String id;

    Marketplace(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<Marketplace> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(m -> m.id.equals(key)).findFirst();
    }
}
