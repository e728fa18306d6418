package com.ticketdesk;

import java.time.Instant;
import java.util.List;

public record ScrapeStatus(
        boolean running,
        Instant startedAt,
        Instant lastSuccess,
        String lastError,
        List<String> lastActivePlatforms,
        List<StrategyAttempt> lastAttempts) {}
