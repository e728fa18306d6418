package com.ticketdesk;

/** Floor and median are whole currency units; count is the deduplicated sample size. */
public record PriceStats(long floor, long median, int count) {}
