package com.ticketdesk;

import java.time.Instant;

/** Answer to a cycle trigger: {@code started}, or {@code already_running} since {@code startedAt}. */
public record TriggerResult(String status, Instant startedAt) {

    public static final String STARTED = "started";
    public static final String ALREADY_RUNNING = "already_running";

    public static TriggerResult started(Instant at) {
        return new TriggerResult(STARTED, at);
    }

    public static TriggerResult alreadyRunning(Instant since) {
        return new TriggerResult(ALREADY_RUNNING, since);
    }
}
