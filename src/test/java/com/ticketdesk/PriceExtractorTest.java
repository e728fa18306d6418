package com.ticketdesk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PriceExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PriceExtractor extractor = new PriceExtractor(mapper);
    private final PriceBounds bounds = new PriceBounds(800, 12000);

    @Nested
    @DisplayName("Structured extraction")
    class Structured {

        @Test
        @DisplayName("nested listings keep only in-range values, strings coerced")
        void nestedListingsFilteredByBounds() throws Exception {
            var tree = mapper.readTree("{\"listings\":[{\"price\":\"$1,234\"},{\"cost\":5000000}]}");

            assertThat(extractor.fromTree(tree, bounds)).containsExactly(1234.0);
        }

        @Test
        void keyMatchIgnoresCaseAndSeparators() throws Exception {
            var tree = mapper.readTree(
                    "{\"a\":{\"SellingPrice\":900},\"b\":{\"selling_price\":1000},\"c\":{\"PRICE\":\"1,100.50\"}}");

            assertThat(extractor.fromTree(tree, bounds)).containsExactlyInAnyOrder(900.0, 1000.0, 1100.5);
        }

        @Test
        void numbersUnderOtherKeysAreIgnored() throws Exception {
            var tree = mapper.readTree("{\"eventId\":5000,\"quantity\":2,\"section\":\"224\",\"row\":1000}");

            assertThat(extractor.fromTree(tree, bounds)).isEmpty();
        }

        @Test
        void arraysUnderPriceKeyAreCollected() throws Exception {
            var tree = mapper.readTree("{\"prices\":[1],\"price\":[950, 1050, \"n/a\", null]}");

            assertThat(extractor.fromTree(tree, bounds)).containsExactly(950.0, 1050.0);
        }

        @Test
        void priceObjectsAreDescendedInto() throws Exception {
            var tree = mapper.readTree("{\"price\":{\"amount\":1500,\"currency\":\"USD\"}}");

            assertThat(extractor.fromTree(tree, bounds)).containsExactly(1500.0);
        }

        @Test
        void boundsAreInclusive() throws Exception {
            var tree = mapper.readTree("[{\"price\":800},{\"price\":12000},{\"price\":799.99},{\"price\":12000.01}]");

            assertThat(extractor.fromTree(tree, bounds)).containsExactly(800.0, 12000.0);
        }
    }

    @Nested
    @DisplayName("Text and fallback")
    class Fallback {

        @Test
        void textScanFindsDollarAmounts() {
            String html = "<div>From $1,250.00</div><span>$ 900</span><b>$75</b><i>$,</i>";

            assertThat(extractor.fromText(html, bounds)).containsExactly(1250.0, 900.0);
        }

        @Test
        void jsonWithoutPriceKeysFallsBackToText() throws Exception {
            String body = "{\"html\":\"<li>Sec 224 Row 17 $1,400</li>\"}";

            assertThat(extractor.fromJson(body, bounds)).containsExactly(1400.0);
        }

        @Test
        void malformedJsonBodyIsReported() {
            assertThatThrownBy(() -> extractor.fromJson("<html>blocked</html>", bounds))
                    .isInstanceOf(JsonProcessingException.class);
        }

        @Test
        void markupPrefersEmbeddedData() {
            String html = "<html><script id=\"__NEXT_DATA__\" type=\"application/json\">"
                    + "{\"props\":{\"listings\":[{\"price\":1300},{\"price\":1700}]}}</script>"
                    + "<p>Suite from $9,999</p></html>";

            assertThat(extractor.fromMarkup(html, bounds)).containsExactly(1300.0, 1700.0);
        }

        @Test
        void markupSkipsBrokenBlocksAndScansText() {
            String html = "<script type=\"application/ld+json\">{not json</script>"
                    + "<script>var price = 4000;</script>"
                    + "<div class=\"listing\">$2,100</div>";

            assertThat(extractor.fromMarkup(html, bounds)).containsExactly(2100.0);
        }

        @Test
        void emptyInputsYieldNothing() {
            assertThat(extractor.fromText(null, bounds)).isEmpty();
            assertThat(extractor.fromMarkup("", bounds)).isEmpty();
            assertThat(extractor.fromTree(null, bounds)).isEmpty();
        }
    }
}
