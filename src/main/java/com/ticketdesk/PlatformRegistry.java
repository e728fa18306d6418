package com.ticketdesk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds one {@link PlatformScraper} per enabled {@link Marketplace}, in enum
 * order. Every platform gets the relay strategy; the API and page strategies
 * only where a URL is configured. Alternate page URLs are tried in listed order.
 */
@Component
public class PlatformRegistry {
    private static final Logger log = LoggerFactory.getLogger(PlatformRegistry.class);

    private final List<PlatformScraper> scrapers;

    @Autowired
    public PlatformRegistry(PlatformProperties platformProps,
                            TicketDeskProperties props,
                            MarketplaceFetcher fetcher,
                            PriceExtractor extractor,
                            RelayStore relayStore) {
        List<PlatformScraper> built = new ArrayList<>();
        PriceBounds global = props.priceBounds();

        for (Marketplace m : Marketplace.values()) {
            PlatformProperties.Endpoint endpoint = platformProps.endpoint(m);
            if (!endpoint.isEnabled()) {
                log.info("{} disabled by configuration", m.id());
                continue;
            }
            PriceBounds bounds = platformProps.bounds(m, global);

            List<RetrievalStrategy> strategies = new ArrayList<>();
            Optional<String> apiUrl = endpoint.resolvedApiUrl();
            if (apiUrl.isPresent()) {
                strategies.add(new JsonApiStrategy(apiUrl.get(), bounds, fetcher, extractor));
            } else if (endpoint.hasApiUrl()) {
                log.warn("No API key configured for {}, skipping its API lookup", m.id());
            }
            for (String pageUrl : endpoint.pageUrls()) {
                strategies.add(new PageScrapeStrategy(pageUrl, bounds, fetcher, extractor));
            }
            strategies.add(new RelayCacheStrategy(m.id(), bounds, relayStore));

            built.add(new PlatformScraper(m.id(), strategies));
            log.info("{}: {} strategies, bounds {}-{}", m.id(), strategies.size(), bounds.min(), bounds.max());
        }
        this.scrapers = List.copyOf(built);
    }

    PlatformRegistry(List<PlatformScraper> scrapers) {
        this.scrapers = List.copyOf(scrapers);
    }

    public List<PlatformScraper> scrapers() {
        return scrapers;
    }

    public boolean isRegistered(String platform) {
        return scrapers.stream().anyMatch(s -> s.platform().equals(platform));
    }
}
