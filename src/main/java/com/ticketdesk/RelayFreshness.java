package com.ticketdesk;

import java.time.Instant;
import java.time.LocalDate;

/** How current a platform's relay entry is, for the status endpoint. */
public record RelayFreshness(LocalDate date, Instant timestamp, boolean fresh, double floor, double median) {}
