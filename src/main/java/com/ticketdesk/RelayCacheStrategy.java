package com.ticketdesk;

import java.time.LocalDate;

/** Last resort: today's relay submission for the platform, if someone sent one. */
public class RelayCacheStrategy implements RetrievalStrategy {

    private final String platform;
    private final PriceBounds bounds;
    private final RelayStore relayStore;

    public RelayCacheStrategy(String platform, PriceBounds bounds, RelayStore relayStore) {
        this.platform = platform;
        this.bounds = bounds;
        this.relayStore = relayStore;
    }

    @Override
    public ScrapeStage stage() {
        return ScrapeStage.RELAY;
    }

    @Override
    public String describe() {
        return "relay:" + platform;
    }

    @Override
    public StrategyOutcome attempt(LocalDate today) {
        RelayEntry entry;
        try {
            entry = relayStore.findFresh(platform, today).orElse(null);
        } catch (RelayStoreException e) {
            return StrategyOutcome.transportError("relay cache unreadable: " + e.getMessage());
        }
        if (entry == null) {
            return StrategyOutcome.notFound("no relay entry for " + today);
        }

        PlatformResult result;
        try {
            result = PlatformResult.relayed(entry);
        } catch (IllegalArgumentException e) {
            return StrategyOutcome.notFound("relay entry rejected: " + e.getMessage());
        }
        if (!result.within(bounds)) {
            return StrategyOutcome.notFound("relay entry outside " + bounds.min() + "-" + bounds.max());
        }
        return StrategyOutcome.found(result);
    }
}
