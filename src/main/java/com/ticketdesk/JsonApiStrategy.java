package com.ticketdesk;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.http.MediaType;

import java.util.List;
import java.util.regex.Pattern;

/** Structured marketplace endpoint; the first thing tried for a platform. */
public class JsonApiStrategy extends FetchingStrategy {
    private static final Pattern API_KEY_PARAM = Pattern.compile("(?i)(api_?key=)[^&]*");

    public JsonApiStrategy(String url, PriceBounds bounds, MarketplaceFetcher fetcher, PriceExtractor extractor) {
        super(url, bounds, fetcher, extractor);
    }

    @Override
    public ScrapeStage stage() {
        return ScrapeStage.PRIMARY;
    }

    // attempts end up in /status, keep the key out of them
    @Override
    public String describe() {
        return API_KEY_PARAM.matcher(url).replaceAll("$1***");
    }

    @Override
    protected MediaType accept() {
        return MediaType.APPLICATION_JSON;
    }

    @Override
    protected List<Double> extract(String body) throws JsonProcessingException {
        return extractor.fromJson(body, bounds);
    }
}
