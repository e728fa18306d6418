package com.ticketdesk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/** The cross-platform composite for one UTC calendar day. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DailyRecord(
        LocalDate date,
        Instant timestamp,
        long crossMedian,
        long crossFloor,
        int totalInventory,
        double platformSpreadPct,
        String source,
        Map<String, PlatformResult> platforms) {}
