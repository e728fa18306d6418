package com.ticketdesk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.LocalDate;

/** An externally supplied platform summary, good for its own UTC date only. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelayEntry(
        String platform,
        double floor,
        double median,
        int sampleCount,
        LocalDate date,
        Instant timestamp) {

    public boolean isFor(LocalDate day) {
        return date != null && date.equals(day);
    }
}
