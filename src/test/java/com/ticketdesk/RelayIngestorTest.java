package com.ticketdesk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RelayIngestorTest {

    private static final Instant NOW = Instant.parse("2026-05-02T18:45:00Z");

    @TempDir
    Path dir;

    private RelayStore relayStore;
    private RelayIngestor ingestor;
    private PlatformProperties platformProps;
    private TicketDeskProperties props;

    @BeforeEach
    void setUp() {
        relayStore = new RelayStore(new ObjectMapper().findAndRegisterModules(), dir.resolve("relay_data.json"));

        props = mock(TicketDeskProperties.class);
        when(props.priceBounds()).thenReturn(new PriceBounds(800, 12000));

        platformProps = new PlatformProperties();
        PlatformProperties.Endpoint ticketmaster = new PlatformProperties.Endpoint();
        ticketmaster.setPriceMin(1000.0);
        platformProps.getPlatforms().put("ticketmaster", ticketmaster);

        PlatformRegistry registry = new PlatformRegistry(List.of(
                new PlatformScraper("stubhub", List.of()),
                new PlatformScraper("vividseats", List.of()),
                new PlatformScraper("ticketmaster", List.of())));

        ingestor = new RelayIngestor(relayStore, registry, platformProps, props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Accepted submissions")
    class Accepted {

        @Test
        void storedWithTodaysUtcDate() {
            RelayEntry entry = ingestor.submit(new RelaySubmission("VividSeats", 950.0, 1400.0, 12));

            assertThat(entry.platform()).isEqualTo("vividseats");
            assertThat(entry.date()).isEqualTo(LocalDate.of(2026, 5, 2));
            assertThat(entry.timestamp()).isEqualTo(NOW);
            assertThat(relayStore.readAll()).containsKey("vividseats");
        }

        @Test
        void platformNameIsNormalised() {
            RelayEntry entry = ingestor.submit(new RelaySubmission("  StubHub ", 950.0, 1400.0, 2));

            assertThat(entry.platform()).isEqualTo("stubhub");
        }

        @Test
        @DisplayName("an accepted entry for a platform with its own bounds is usable by the relay strategy")
        void acceptedEntryIsServedByRelayStrategy() {
            ingestor.submit(new RelaySubmission("ticketmaster", 1100.0, 1500.0, 6));

            RelayCacheStrategy strategy = new RelayCacheStrategy("ticketmaster",
                    platformProps.bounds(Marketplace.TICKETMASTER, props.priceBounds()), relayStore);
            StrategyOutcome outcome = strategy.attempt(LocalDate.of(2026, 5, 2));

            assertThat(outcome.kind()).isEqualTo(StrategyOutcome.Kind.FOUND);
            assertThat(outcome.result()).get().extracting(PlatformResult::floor).isEqualTo(1100L);
        }

        @Test
        void missingSampleCountMeansZero() {
            RelayEntry entry = ingestor.submit(new RelaySubmission("stubhub", 950.0, 1400.0, null));

            assertThat(entry.sampleCount()).isZero();
        }

        @Test
        void lastSubmissionWins() {
            ingestor.submit(new RelaySubmission("stubhub", 950.0, 1400.0, 12));
            ingestor.submit(new RelaySubmission("stubhub", 1000.0, 1300.0, 9));

            RelayEntry stored = relayStore.readAll().get("stubhub");
            assertThat(stored.floor()).isEqualTo(1000.0);
            assertThat(stored.median()).isEqualTo(1300.0);
            assertThat(stored.sampleCount()).isEqualTo(9);
        }
    }

    @Nested
    @DisplayName("Rejected submissions")
    class Rejected {

        @Test
        void floorBelowMinimumLeavesStoreUnchanged() {
            ingestor.submit(new RelaySubmission("stubhub", 950.0, 1400.0, 12));

            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission("stubhub", 500.0, 1400.0, 3)))
                    .isInstanceOf(RelayValidationException.class)
                    .hasMessageContaining("floor");

            assertThat(relayStore.readAll().get("stubhub").floor()).isEqualTo(950.0);
        }

        @Test
        @DisplayName("platform bounds tighter than the global ones apply to relayed prices")
        void floorBelowPlatformMinimum() {
            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission("ticketmaster", 900.0, 1400.0, 3)))
                    .isInstanceOf(RelayValidationException.class)
                    .hasMessageContaining("floor 900.0 outside 1000.0-12000.0");
            assertThat(relayStore.readAll()).isEmpty();

            // the same floor is fine where only the global bounds apply
            ingestor.submit(new RelaySubmission("stubhub", 900.0, 1400.0, 3));
            assertThat(relayStore.readAll()).containsOnlyKeys("stubhub");
        }

        @Test
        void unregisteredMarketplace() {
            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission("seatgeek", 950.0, 1400.0, 3)))
                    .isInstanceOf(RelayValidationException.class)
                    .hasMessageContaining("unknown platform 'seatgeek'");
        }

        @Test
        void medianAboveMaximum() {
            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission("stubhub", 950.0, 15000.0, 3)))
                    .isInstanceOf(RelayValidationException.class)
                    .hasMessageContaining("median");
            assertThat(relayStore.readAll()).isEmpty();
        }

        @Test
        void missingFields() {
            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission(null, 950.0, 1400.0, 3)))
                    .hasMessageContaining("platform is required");
            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission("stubhub", null, 1400.0, 3)))
                    .hasMessageContaining("floor is required");
            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission("stubhub", 950.0, null, 3)))
                    .hasMessageContaining("median is required");
            assertThatThrownBy(() -> ingestor.submit(null))
                    .isInstanceOf(RelayValidationException.class);
        }

        @Test
        void unknownPlatform() {
            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission("craigslist", 950.0, 1400.0, 3)))
                    .isInstanceOf(RelayValidationException.class)
                    .hasMessageContaining("unknown platform");
        }

        @Test
        void floorAboveMedian() {
            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission("stubhub", 1500.0, 1400.0, 3)))
                    .isInstanceOf(RelayValidationException.class);
        }

        @Test
        void negativeSampleCount() {
            assertThatThrownBy(() -> ingestor.submit(new RelaySubmission("stubhub", 950.0, 1400.0, -1)))
                    .isInstanceOf(RelayValidationException.class);
        }
    }
}
