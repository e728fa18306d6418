package com.ticketdesk;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/** Random pause between marketplaces so a cycle looks less like a bot. */
@Component
public class PacingDelay {

    private final long minMs;
    private final long maxMs;

    @Autowired
    public PacingDelay(TicketDeskProperties props) {
        this(props.getPacingMinMs(), props.getPacingMaxMs());
    }

    PacingDelay(long minMs, long maxMs) {
        this.minMs = Math.max(0, minMs);
        this.maxMs = Math.max(this.minMs, maxMs);
    }

    public void pause() {
        if (maxMs == 0) return;
        long ms = minMs == maxMs ? minMs : ThreadLocalRandom.current().nextLong(minMs, maxMs + 1);
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
