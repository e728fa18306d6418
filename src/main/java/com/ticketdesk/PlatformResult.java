package com.ticketdesk;

/** One platform's summary for one scrape cycle. */
public record PlatformResult(long floor, long median, int sampleCount, Provenance provenance) {

    public PlatformResult {
        if (floor > median) {
            throw new IllegalArgumentException("floor " + floor + " above median " + median);
        }
    }

    public static PlatformResult direct(PriceStats stats) {
        return new PlatformResult(stats.floor(), stats.median(), stats.count(), Provenance.DIRECT);
    }

    public static PlatformResult relayed(RelayEntry entry) {
        return new PlatformResult(Math.round(entry.floor()), Math.round(entry.median()),
                entry.sampleCount(), Provenance.RELAY);
    }

    public boolean within(PriceBounds bounds) {
        return bounds.contains(floor) && bounds.contains(median);
    }
}
