package com.ticketdesk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Accepts price summaries for platforms we cannot scrape ourselves. An accepted
 * submission replaces the platform's previous entry and is usable by scrape
 * cycles until the UTC date rolls over.
 */
@Service
public class RelayIngestor {
    private static final Logger log = LoggerFactory.getLogger(RelayIngestor.class);

    private final RelayStore relayStore;
    private final PlatformRegistry registry;
    private final PlatformProperties platformProps;
    private final TicketDeskProperties props;
    private final Clock clock;

    public RelayIngestor(RelayStore relayStore, PlatformRegistry registry, PlatformProperties platformProps,
                         TicketDeskProperties props, Clock clock) {
        this.relayStore = relayStore;
        this.registry = registry;
        this.platformProps = platformProps;
        this.props = props;
        this.clock = clock;
    }

    /** @throws RelayValidationException with a reason the submitter can act on */
    public RelayEntry submit(RelaySubmission submission) {
        if (submission == null) {
            throw new RelayValidationException("empty submission");
        }
        if (submission.platform() == null || submission.platform().isBlank()) {
            throw new RelayValidationException("platform is required");
        }
        Marketplace marketplace = Marketplace.fromId(submission.platform())
                .filter(m -> registry.isRegistered(m.id()))
                .orElseThrow(() -> new RelayValidationException(
                        "unknown platform '" + submission.platform().trim() + "'"));
        String platform = marketplace.id();
        if (submission.floor() == null) {
            throw new RelayValidationException("floor is required");
        }
        if (submission.median() == null) {
            throw new RelayValidationException("median is required");
        }

        // the relay strategy reads with these same bounds, so nothing accepted here is unusable
        PriceBounds bounds = platformProps.bounds(marketplace, props.priceBounds());
        double floor = submission.floor();
        double median = submission.median();
        if (!bounds.contains(floor)) {
            throw new RelayValidationException(
                    "floor " + floor + " outside " + bounds.min() + "-" + bounds.max());
        }
        if (!bounds.contains(median)) {
            throw new RelayValidationException(
                    "median " + median + " outside " + bounds.min() + "-" + bounds.max());
        }
        if (floor > median) {
            throw new RelayValidationException("floor " + floor + " is above median " + median);
        }
        int sampleCount = submission.sampleCount() == null ? 0 : submission.sampleCount();
        if (sampleCount < 0) {
            throw new RelayValidationException("sampleCount must not be negative");
        }

        Instant now = clock.instant();
        RelayEntry entry = new RelayEntry(platform, floor, median, sampleCount,
                LocalDate.ofInstant(now, ZoneOffset.UTC), now);
        Optional<RelayEntry> previous = relayStore.put(entry);

        // last write wins; the log is the only record of what got replaced
        previous.ifPresentOrElse(
                p -> log.info("Relay {} replaced entry of {} (floor {} -> {}, median {} -> {}, count {} -> {})",
                        platform, p.date(), p.floor(), floor, p.median(), median, p.sampleCount(), sampleCount),
                () -> log.info("Relay {} stored: floor={}, median={}, count={}", platform, floor, median, sampleCount));
        return entry;
    }
}
