package com.chaincollector.unit.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.chaincollector.analytics.ChainAnalytics;
import com.chaincollector.analytics.OptionMetrics;
import com.chaincollector.domain.enums.OptionKind;
import com.chaincollector.domain.model.EnrichedOption;
import com.chaincollector.domain.model.Ohlc;
import com.chaincollector.unit.support.Fixtures;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ChainAnalyticsTest {

    private static final LocalDate EXPIRY = LocalDate.of(2025, 6, 26);

    private final EnrichedOption ce24750 = Fixtures.enriched("NIFTY", EXPIRY, 24_750, OptionKind.CE, "130", 3000);
    private final EnrichedOption ce24800 = Fixtures.enriched("NIFTY", EXPIRY, 24_800, OptionKind.CE, "95", 1000);
    private final EnrichedOption pe24800 = Fixtures.enriched("NIFTY", EXPIRY, 24_800, OptionKind.PE, "80", 2000);
    private final EnrichedOption pe24900 = Fixtures.enriched("NIFTY", EXPIRY, 24_900, OptionKind.PE, "150", 6000);

    @Nested
    @DisplayName("Put-call ratio")
    class Pcr {

        @Test
        @DisplayName("Put OI over call OI, rounded to 4 places")
        void ratio() {
            assertThat(ChainAnalytics.putCallRatio(List.of(ce24750, ce24800, pe24800, pe24900)))
                    .isEqualByComparingTo("2.0000");
        }

        @Test
        @DisplayName("No call OI gives zero")
        void noCalls() {
            assertThat(ChainAnalytics.putCallRatio(List.of(pe24800))).isEqualByComparingTo("0");
        }
    }

    @Test
    @DisplayName("Day width is high minus low, absent when not positive")
    void dayWidth() {
        assertThat(ChainAnalytics.dayWidth(Fixtures.ohlc("24700", "24910.5", "24650", "24800")))
                .hasValueSatisfying(w -> assertThat(w).isEqualByComparingTo("260.5"));
        assertThat(ChainAnalytics.dayWidth(Ohlc.empty())).isEmpty();
        assertThat(ChainAnalytics.dayWidth(null)).isEmpty();
    }

    @Nested
    @DisplayName("Per-option metrics")
    class PerOption {

        @Test
        @DisplayName("Intrinsic and time value per side")
        void values() {
            Map<String, OptionMetrics> metrics = ChainAnalytics.perOptionMetrics(
                    List.of(ce24750, ce24800, pe24800, pe24900), new BigDecimal("24820"), 24_800, 50, 5);

            OptionMetrics itmCall = metrics.get(ce24750.getKey());
            assertThat(itmCall.getIntrinsic()).isEqualByComparingTo("70");
            assertThat(itmCall.getTimeValue()).isEqualByComparingTo("60");
            assertThat(itmCall.getOiShare()).isEqualByComparingTo("0.75");

            OptionMetrics itmPut = metrics.get(pe24900.getKey());
            assertThat(itmPut.getIntrinsic()).isEqualByComparingTo("80");
            assertThat(itmPut.getTimeValue()).isEqualByComparingTo("70");

            assertThat(metrics.get(pe24800.getKey()).getIntrinsic()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Only strikes within the window get metrics")
        void window() {
            Map<String, OptionMetrics> metrics = ChainAnalytics.perOptionMetrics(
                    List.of(ce24750, ce24800, pe24800, pe24900), new BigDecimal("24820"), 24_800, 50, 1);

            assertThat(metrics).containsOnlyKeys(ce24750.getKey(), ce24800.getKey(), pe24800.getKey());
        }

        @Test
        @DisplayName("An unbounded window is safe")
        void unbounded() {
            assertThat(ChainAnalytics.perOptionMetrics(
                            List.of(ce24800, pe24900), new BigDecimal("24820"), 24_800, 50, Integer.MAX_VALUE))
                    .hasSize(2);
        }

        @Test
        @DisplayName("No spot means no metrics")
        void noSpot() {
            assertThat(ChainAnalytics.perOptionMetrics(List.of(ce24800), null, 24_800, 50, 5)).isEmpty();
        }
    }
}
