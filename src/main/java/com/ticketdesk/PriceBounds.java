package com.ticketdesk;

/** Inclusive range a listing price must fall in to count for this section. */
public record PriceBounds(double min, double max) {

    public PriceBounds {
        if (min > max) {
            throw new IllegalArgumentException("price bounds inverted: min=" + min + " max=" + max);
        }
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
