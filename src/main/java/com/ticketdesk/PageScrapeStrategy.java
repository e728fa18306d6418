package com.ticketdesk;

import org.springframework.http.MediaType;

import java.util.List;

/** Full listing page: embedded script data first, then dollar amounts in the markup. */
public class PageScrapeStrategy extends FetchingStrategy {

    public PageScrapeStrategy(String url, PriceBounds bounds, MarketplaceFetcher fetcher, PriceExtractor extractor) {
        super(url, bounds, fetcher, extractor);
    }

    @Override
    public ScrapeStage stage() {
        return ScrapeStage.SECONDARY;
    }

    @Override
    protected MediaType accept() {
        return MediaType.TEXT_HTML;
    }

    @Override
    protected List<Double> extract(String body) {
        return extractor.fromMarkup(body, bounds);
    }
}
