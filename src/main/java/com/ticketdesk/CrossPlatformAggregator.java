package com.ticketdesk;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Folds the platforms that returned data into one composite daily record. */
@Component
public class CrossPlatformAggregator {

    static final String SOURCE = "scraper";

    /**
     * @param active platform name to result, only for platforms with data
     * @throws NoActivePlatformsException if {@code active} is empty
     */
    public DailyRecord aggregate(Map<String, PlatformResult> active, Instant now) {
        if (active == null || active.isEmpty()) {
            throw new NoActivePlatformsException("All platforms returned no data, likely blocked");
        }

        double medianSum = 0;
        long maxMedian = Long.MIN_VALUE;
        long minMedian = Long.MAX_VALUE;
        long minFloor = Long.MAX_VALUE;
        int inventory = 0;
        for (PlatformResult r : active.values()) {
            medianSum += r.median();
            maxMedian = Math.max(maxMedian, r.median());
            minMedian = Math.min(minMedian, r.median());
            minFloor = Math.min(minFloor, r.floor());
            inventory += r.sampleCount();
        }

        long crossMedian = Math.round(medianSum / active.size());
        double spreadPct = 0;
        if (active.size() >= 2 && crossMedian != 0) {
            spreadPct = PriceStatistics.round1((maxMedian - minMedian) * 100.0 / crossMedian);
        }

        return new DailyRecord(
                LocalDate.ofInstant(now, ZoneOffset.UTC),
                now,
                crossMedian,
                minFloor,
                inventory,
                spreadPct,
                SOURCE,
                Collections.unmodifiableMap(new LinkedHashMap<>(active)));
    }
}
