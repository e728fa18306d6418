package com.ticketdesk;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class PriceStatisticsTest {

    @Test
    void duplicatesCollapseBeforeMedian() {
        PriceStats stats = PriceStatistics.summarize(List.of(100.0, 100.0, 200.0)).orElseThrow();

        assertThat(stats.floor()).isEqualTo(100);
        assertThat(stats.median()).isEqualTo(150);
        assertThat(stats.count()).isEqualTo(2);
    }

    @Test
    void emptyInputHasNoResult() {
        assertThat(PriceStatistics.summarize(List.of())).isEmpty();
        assertThat(PriceStatistics.summarize(null)).isEmpty();
        assertThat(PriceStatistics.summarize(Arrays.asList(null, Double.NaN))).isEmpty();
    }

    @Test
    void evenCountAveragesMiddlePair() {
        PriceStats stats = PriceStatistics.summarize(List.of(400.0, 100.0, 300.0, 200.0)).orElseThrow();

        assertThat(stats.median()).isEqualTo(250);
        assertThat(stats.floor()).isEqualTo(100);
        assertThat(stats.count()).isEqualTo(4);
    }

    @Test
    void oddCountTakesMiddle() {
        PriceStats stats = PriceStatistics.summarize(List.of(900.0, 1500.0, 1100.0)).orElseThrow();

        assertThat(stats.median()).isEqualTo(1100);
    }

    @Test
    void floorAndMedianRoundToWholeUnits() {
        PriceStats stats = PriceStatistics.summarize(List.of(1000.4, 1001.5)).orElseThrow();

        assertThat(stats.floor()).isEqualTo(1000);
        // (1000.4 + 1001.5) / 2 = 1000.95
        assertThat(stats.median()).isEqualTo(1001);
    }

    @Test
    void inputListIsNotModified() {
        List<Double> prices = new ArrayList<>(List.of(300.0, 100.0, 200.0));

        PriceStatistics.summarize(prices);

        assertThat(prices).containsExactly(300.0, 100.0, 200.0);
    }

    @Test
    void roundsToOneDecimal() {
        assertThat(PriceStatistics.round1(18.1818)).isEqualTo(18.2);
        assertThat(PriceStatistics.round1(-4.04)).isEqualTo(-4.0);
    }
}
