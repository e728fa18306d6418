package com.ticketdesk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls candidate listing prices out of marketplace responses.
 *
 * Structured data is walked recursively and every number found under a
 * price-like key is collected. When that yields nothing, the raw text is
 * scanned for dollar amounts instead. Either way only values inside the
 * configured {@link PriceBounds} survive; anything outside is another
 * inventory tier (suites, floor seats) rather than a bad read.
 */
@Component
public class PriceExtractor {
    private static final Logger log = LoggerFactory.getLogger(PriceExtractor.class);

    // compared after lower-casing and dropping '_' / '-'
    static final Set<String> PRICE_KEYS = Set.of(
            "price", "amount", "cost",
            "sellingprice", "listingprice", "displayprice", "currentprice", "rawprice",
            "pricewithfees", "allinprice",
            "lowprice", "highprice", "minprice", "maxprice");

    private static final Pattern MONEY = Pattern.compile("\\$\\s*([\\d,]+(?:\\.\\d{2})?)");

    private static final Pattern PRICE_STRING = Pattern.compile(
            "^\\s*(?:[A-Z]{3}\\s*)?[$€£]?\\s*([\\d,]+(?:\\.\\d+)?)\\s*(?:[A-Z]{3})?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SCRIPT = Pattern.compile(
            "<script\\b([^>]*)>(.*?)</script>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final Pattern DATA_SCRIPT_ATTRS = Pattern.compile(
            "type\\s*=\\s*[\"']application/(?:ld\\+)?json[\"']|id\\s*=\\s*[\"']__NEXT_DATA__[\"']",
            Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public PriceExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Every in-bounds number reachable under a price-like key. */
    public List<Double> fromTree(JsonNode root, PriceBounds bounds) {
        List<Double> prices = new ArrayList<>();
        if (root != null) {
            visit(root, false, bounds, prices);
        }
        return prices;
    }

    /** Dollar amounts anywhere in the text. */
    public List<Double> fromText(String text, PriceBounds bounds) {
        List<Double> prices = new ArrayList<>();
        if (text == null || text.isEmpty()) return prices;

        Matcher m = MONEY.matcher(text);
        while (m.find()) {
            // the pattern also matches a bare "$," in markup
            String digits = m.group(1).replace(",", "");
            if (digits.isEmpty()) continue;
            double v = Double.parseDouble(digits);
            if (bounds.contains(v)) prices.add(v);
        }
        return prices;
    }

    /**
     * A JSON API body. Falls back to a text scan of the same body when the
     * tree has no price fields.
     *
     * @throws JsonProcessingException if the body is not JSON at all
     */
    public List<Double> fromJson(String body, PriceBounds bounds) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(body);
        List<Double> prices = fromTree(root, bounds);
        if (prices.isEmpty()) {
            prices = fromText(body, bounds);
        }
        return prices;
    }

    /**
     * An HTML page. Embedded JSON blocks (JSON-LD, application/json, Next.js
     * page data) are tried first; unparseable blocks are skipped.
     */
    public List<Double> fromMarkup(String html, PriceBounds bounds) {
        List<Double> prices = new ArrayList<>();
        if (html == null || html.isEmpty()) return prices;

        Matcher m = SCRIPT.matcher(html);
        int blocks = 0;
        while (m.find()) {
            if (!DATA_SCRIPT_ATTRS.matcher(m.group(1)).find()) continue;
            blocks++;
            try {
                prices.addAll(fromTree(objectMapper.readTree(m.group(2).trim()), bounds));
            } catch (JsonProcessingException e) {
                log.debug("Skipping unparseable embedded data block: {}", e.getOriginalMessage());
            }
        }

        if (prices.isEmpty()) {
            log.debug("No structured prices in {} embedded blocks, scanning page text", blocks);
            prices = fromText(html, bounds);
        }
        return prices;
    }

    private void visit(JsonNode node, boolean underPriceKey, PriceBounds bounds, List<Double> out) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                visit(field.getValue(), isPriceKey(field.getKey()), bounds, out);
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                visit(child, underPriceKey, bounds, out);
            }
        } else if (underPriceKey) {
            Double v = coerce(node);
            if (v != null && bounds.contains(v)) out.add(v);
        }
    }

    static boolean isPriceKey(String key) {
        String normalized = key.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return PRICE_KEYS.contains(normalized);
    }

    private static Double coerce(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            Matcher m = PRICE_STRING.matcher(node.asText());
            if (m.matches()) {
                String digits = m.group(1).replace(",", "");
                if (!digits.isEmpty()) {
                    return Double.parseDouble(digits);
                }
            }
        }
        return null;
    }
}
