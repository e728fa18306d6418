package com.ticketdesk;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Process-wide cycle state. Only {@link ScrapeCycleService} changes it; the
 * status endpoint reads consistent snapshots.
 */
@Component
public class ScrapeState {

    private boolean running;
    private Instant startedAt;
    private Instant lastSuccess;
    private String lastError;
    private List<String> lastActivePlatforms = List.of();
    private List<StrategyAttempt> lastAttempts = List.of();

    /** Claims the single cycle slot. False if a cycle is already running. */
    public synchronized boolean tryStart(Instant now) {
        if (running) return false;
        running = true;
        startedAt = now;
        lastError = null;
        return true;
    }

    public synchronized void succeeded(Instant at, List<String> activePlatforms, List<StrategyAttempt> attempts) {
        lastSuccess = at;
        lastError = null;
        lastActivePlatforms = List.copyOf(activePlatforms);
        lastAttempts = List.copyOf(attempts);
    }

    public synchronized void failed(String error, List<StrategyAttempt> attempts) {
        lastError = error;
        lastActivePlatforms = List.of();
        lastAttempts = List.copyOf(attempts);
    }

    public synchronized void finish() {
        running = false;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized ScrapeStatus snapshot() {
        return new ScrapeStatus(running, startedAt, lastSuccess, lastError, lastActivePlatforms, lastAttempts);
    }
}
