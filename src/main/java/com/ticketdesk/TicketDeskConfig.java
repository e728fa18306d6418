package com.ticketdesk;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class TicketDeskConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Cycles run one at a time off the request and scheduler threads. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scrapeExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "scrape-cycle");
            t.setDaemon(true);
            return t;
        });
    }
}
