package com.ticketdesk;

import java.util.List;

/**
 * Movement between the two latest daily records plus the last seven values of
 * each series. {@code inventoryWowPct} is null when there is no usable prior day.
 */
public record Trends(
        double medianSlope7d,
        double floorAccel,
        Double inventoryWowPct,
        Integer priorInventory,
        List<Long> medians7d,
        List<Long> floors7d,
        List<Integer> inventory7d) {}
