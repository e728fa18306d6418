package com.ticketdesk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

/**
 * Plain GET against a marketplace. Failures (non-2xx, connect errors, the block
 * timeout) surface as unchecked exceptions for the calling strategy to absorb.
 */
@Component
public class MarketplaceFetcher {
    private static final Logger log = LoggerFactory.getLogger(MarketplaceFetcher.class);

    private static final String BROWSER_UA =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";

    // listing pages run to a few MB of inline script
    private static final int MAX_BODY_BYTES = 16 * 1024 * 1024;

    private final WebClient http;
    private final Duration timeout;

    public MarketplaceFetcher(WebClient.Builder builder, TicketDeskProperties props) {
        this.http = builder
                .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_UA)
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                .build();
        this.timeout = Duration.ofSeconds(props.getFetchTimeoutSeconds());
    }

    public String fetch(String url, MediaType accept) {
        log.debug("GET {} (accept {})", url, accept);
        return http.get()
                .uri(URI.create(url))
                .accept(accept, MediaType.ALL)
                .retrieve()
                .bodyToMono(String.class)
                .block(timeout);
    }
}
