package com.ticketdesk;

import java.time.Instant;

public record HistoryMeta(
        Instant generated,
        String event,
        String section,
        String row,
        String seatType,
        String source,
        String service) {}
