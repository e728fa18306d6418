package com.ticketdesk;

import java.util.List;
import java.util.Optional;

public record PlatformScrapeReport(String platform, PlatformResult result, List<StrategyAttempt> attempts) {

    public Optional<PlatformResult> resultIfActive() {
        return Optional.ofNullable(result);
    }
}
