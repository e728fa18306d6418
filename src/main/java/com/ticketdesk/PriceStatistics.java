package com.ticketdesk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/** Floor/median summary over a set of extracted listing prices. */
public final class PriceStatistics {

    private PriceStatistics() {}

    /**
     * Identical prices collapse into one listing signal, since the same listing is
     * usually mirrored in several fields of a page. Empty input means the platform
     * had nothing usable this cycle, not a price of zero.
     */
    public static Optional<PriceStats> summarize(List<Double> prices) {
        if (prices == null || prices.isEmpty()) return Optional.empty();

        TreeSet<Double> unique = new TreeSet<>();
        for (Double p : prices) {
            if (p != null && !p.isNaN()) unique.add(p);
        }
        if (unique.isEmpty()) return Optional.empty();

        List<Double> sorted = new ArrayList<>(unique);
        int n = sorted.size();
        double floor = sorted.get(0);
        double median;
        if (n % 2 == 1) {
            median = sorted.get(n / 2);
        } else {
            median = (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
        }
        return Optional.of(new PriceStats(Math.round(floor), Math.round(median), n));
    }

    /** Rounds to one decimal place, half up. */
    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
