package com.ticketdesk;

/** Diagnostic line for a single strategy attempt, surfaced through /status. */
public record StrategyAttempt(
        String platform,
        ScrapeStage stage,
        String strategy,
        StrategyOutcome.Kind outcome,
        int sampleCount,
        String detail,
        long elapsedMs) {}
