package com.ticketdesk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs one marketplace's strategies in stage order and stops at the first that
 * finds prices. Coming back empty is normal (the site blocked us, or nobody
 * relayed today) and is reported, not thrown.
 */
public class PlatformScraper {
    private static final Logger log = LoggerFactory.getLogger(PlatformScraper.class);

    private final String platform;
    private final List<RetrievalStrategy> strategies;

    public PlatformScraper(String platform, List<RetrievalStrategy> strategies) {
        this.platform = platform;
        List<RetrievalStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparing(RetrievalStrategy::stage));
        this.strategies = List.copyOf(ordered);
    }

    public String platform() {
        return platform;
    }

    public List<RetrievalStrategy> strategies() {
        return strategies;
    }

    public PlatformScrapeReport scrape(LocalDate today) {
        List<StrategyAttempt> attempts = new ArrayList<>();

        for (RetrievalStrategy strategy : strategies) {
            long start = System.nanoTime();
            StrategyOutcome outcome;
            try {
                outcome = strategy.attempt(today);
            } catch (RuntimeException e) {
                // strategies shouldn't throw, but one bad platform must not end the cycle
                log.error("{} {} threw unexpectedly", platform, strategy.stage(), e);
                outcome = StrategyOutcome.transportError(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            int count = outcome.result().map(PlatformResult::sampleCount).orElse(0);
            attempts.add(new StrategyAttempt(platform, strategy.stage(), strategy.describe(),
                    outcome.kind(), count, outcome.detail(), elapsedMs));

            switch (outcome.kind()) {
                case FOUND -> {
                    PlatformResult result = outcome.result().orElseThrow();
                    log.info("{}: {} prices via {}, floor={}, median={}",
                            platform, result.sampleCount(), strategy.stage(), result.floor(), result.median());
                    return new PlatformScrapeReport(platform, result, attempts);
                }
                case NOT_FOUND -> log.info("{} {}: no data ({})", platform, strategy.stage(), outcome.detail());
                case TRANSPORT_ERROR -> log.warn("{} {} failed: {}", platform, strategy.stage(), outcome.detail());
            }
        }

        log.info("{} -> no data this cycle after {} strategies", platform, attempts.size());
        return new PlatformScrapeReport(platform, null, attempts);
    }
}
