package com.ticketdesk;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.LocalDate;
import java.util.List;

/** Shared fetch-extract-summarize path for the strategies that go over the network. */
abstract class FetchingStrategy implements RetrievalStrategy {

    protected final String url;
    protected final PriceBounds bounds;
    protected final MarketplaceFetcher fetcher;
    protected final PriceExtractor extractor;

    FetchingStrategy(String url, PriceBounds bounds, MarketplaceFetcher fetcher, PriceExtractor extractor) {
        this.url = url;
        this.bounds = bounds;
        this.fetcher = fetcher;
        this.extractor = extractor;
    }

    protected abstract MediaType accept();

    protected abstract List<Double> extract(String body) throws JsonProcessingException;

    @Override
    public StrategyOutcome attempt(LocalDate today) {
        String body;
        try {
            body = fetcher.fetch(url, accept());
        } catch (WebClientResponseException e) {
            return StrategyOutcome.transportError("HTTP " + e.getStatusCode().value());
        } catch (RuntimeException e) {
            return StrategyOutcome.transportError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (body == null || body.isBlank()) {
            return StrategyOutcome.transportError("empty body");
        }

        List<Double> prices;
        try {
            prices = extract(body);
        } catch (JsonProcessingException e) {
            return StrategyOutcome.transportError("malformed payload: " + e.getOriginalMessage());
        }

        return PriceStatistics.summarize(prices)
                .map(stats -> StrategyOutcome.found(PlatformResult.direct(stats)))
                .orElseGet(() -> StrategyOutcome.notFound("no prices in " + body.length() + " chars"));
    }

    @Override
    public String describe() {
        return url;
    }
}
