package com.ticketdesk;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-marketplace endpoints, keyed by {@link Marketplace#id()}:
 *
 * <pre>
 * ticketdesk.platforms.stubhub.page-url=https://...
 * ticketdesk.platforms.ticketmaster.api-url=https://.../events/X.json?apikey={apiKey}
 * ticketdesk.platforms.ticketmaster.api-key=${TICKETMASTER_API_KEY:}
 * ticketdesk.platforms.ticketmaster.alternate-page-urls[0]=https://...
 * ticketdesk.platforms.tickpick.price-min=300
 * </pre>
 *
 * A marketplace with neither URL is still polled through the relay.
 */
@Component
@ConfigurationProperties(prefix = "ticketdesk")
public class PlatformProperties {

    private Map<String, Endpoint> platforms = new LinkedHashMap<>();

    public Map<String, Endpoint> getPlatforms() { return platforms; }
    public void setPlatforms(Map<String, Endpoint> platforms) { this.platforms = platforms; }

    public Endpoint endpoint(Marketplace marketplace) {
        return platforms.getOrDefault(marketplace.id(), new Endpoint());
    }

    /** Bounds for both scraped and relayed prices of {@code marketplace}. */
    public PriceBounds bounds(Marketplace marketplace, PriceBounds global) {
        return endpoint(marketplace).boundsOr(global);
    }

    public static class Endpoint {
        static final String API_KEY_PLACEHOLDER = "{apiKey}";

        private boolean enabled = true;
        private String apiUrl;
        private String apiKey;
        private String pageUrl;
        private List<String> alternatePageUrls = new ArrayList<>();
        private Double priceMin;
        private Double priceMax;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getPageUrl() { return pageUrl; }
        public void setPageUrl(String pageUrl) { this.pageUrl = pageUrl; }
        public List<String> getAlternatePageUrls() { return alternatePageUrls; }
        public void setAlternatePageUrls(List<String> alternatePageUrls) { this.alternatePageUrls = alternatePageUrls; }
        public Double getPriceMin() { return priceMin; }
        public void setPriceMin(Double priceMin) { this.priceMin = priceMin; }
        public Double getPriceMax() { return priceMax; }
        public void setPriceMax(Double priceMax) { this.priceMax = priceMax; }

        public boolean hasApiUrl() {
            return hasText(apiUrl);
        }

        /**
         * The API URL with {@code {apiKey}} filled in. Empty when no URL is set,
         * or when the URL needs a key and none is configured.
         */
        public Optional<String> resolvedApiUrl() {
            if (!hasText(apiUrl)) return Optional.empty();
            if (!apiUrl.contains(API_KEY_PLACEHOLDER)) return Optional.of(apiUrl);
            if (!hasText(apiKey)) return Optional.empty();
            return Optional.of(apiUrl.replace(API_KEY_PLACEHOLDER,
                    URLEncoder.encode(apiKey.trim(), StandardCharsets.UTF_8)));
        }

        /** The main page URL followed by its alternates, blanks dropped. */
        public List<String> pageUrls() {
            List<String> urls = new ArrayList<>();
            if (hasText(pageUrl)) urls.add(pageUrl);
            if (alternatePageUrls != null) {
                for (String url : alternatePageUrls) {
                    if (hasText(url)) urls.add(url);
                }
            }
            return urls;
        }

        /** Platform-specific bounds where set, the global ones otherwise. */
        public PriceBounds boundsOr(PriceBounds global) {
            return new PriceBounds(
                    priceMin != null ? priceMin : global.min(),
                    priceMax != null ? priceMax : global.max());
        }

        private static boolean hasText(String s) {
            return s != null && !s.isBlank();
        }
    }
}
