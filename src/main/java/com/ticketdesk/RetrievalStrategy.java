package com.ticketdesk;

import java.time.LocalDate;

/**
 * One way of getting a platform's numbers. Implementations must not throw for
 * network or parsing trouble; that is reported as a {@link StrategyOutcome}.
 */
public interface RetrievalStrategy {

    ScrapeStage stage();

    String describe();

    StrategyOutcome attempt(LocalDate today);
}
