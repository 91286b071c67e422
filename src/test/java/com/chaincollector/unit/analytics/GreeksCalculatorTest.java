package com.chaincollector.unit.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.chaincollector.analytics.GreeksCalculator;
import com.chaincollector.analytics.ImpliedVolatilitySolver;
import com.chaincollector.analytics.OptionGreeks;
import com.chaincollector.domain.enums.OptionKind;
import com.chaincollector.domain.model.EnrichedOption;
import com.chaincollector.unit.support.Fixtures;
import com.chaincollector.unit.support.MutableClock;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for GreeksCalculator and ImpliedVolatilitySolver: IV recovered from a Black-Scholes
 * price, sign conventions of the Greeks and unsolvable inputs.
 */
class GreeksCalculatorTest {

    private static final double RATE = 0.065;
    private static final LocalDate EXPIRY = LocalDate.of(2025, 6, 26);

    /** 10:00 on Jun 11 to 15:30 on Jun 26, in years. */
    private static final double YEARS = (15 * 1440 + 330) / 525_600.0;

    private ImpliedVolatilitySolver solver;
    private GreeksCalculator calculator;

    @BeforeEach
    void setUp() {
        solver = new ImpliedVolatilitySolver();
        calculator = new GreeksCalculator(solver, RATE, MutableClock.IST, MutableClock.atIst(2025, 6, 11, 10, 0));
    }

    private BigDecimal bsPrice(double strike, double sigma, boolean call) {
        return BigDecimal.valueOf(solver.price(24_800, strike, YEARS, RATE, sigma, call));
    }

    @Nested
    @DisplayName("Implied volatility")
    class ImpliedVolatility {

        @Test
        @DisplayName("Recovers the volatility used to price a call")
        void recoversCallIv() {
            OptionGreeks greeks = calculator.calculate(
                    BigDecimal.valueOf(24_800), BigDecimal.valueOf(24_800), EXPIRY, bsPrice(24_800, 0.15, true), true);

            assertThat(greeks.isAvailable()).isTrue();
            assertThat(greeks.getIv().doubleValue()).isCloseTo(15.0, within(0.05));
        }

        @Test
        @DisplayName("Recovers the volatility used to price an OTM put")
        void recoversPutIv() {
            OptionGreeks greeks = calculator.calculate(
                    BigDecimal.valueOf(24_800), BigDecimal.valueOf(24_500), EXPIRY, bsPrice(24_500, 0.18, false), false);

            assertThat(greeks.getIv().doubleValue()).isCloseTo(18.0, within(0.05));
        }

        @Test
        @DisplayName("A zero price or missing input is unavailable")
        void unsolvable() {
            assertThat(calculator.calculate(BigDecimal.valueOf(24_800), BigDecimal.valueOf(24_800), EXPIRY,
                    BigDecimal.ZERO, true).isAvailable()).isFalse();
            assertThat(calculator.calculate(null, BigDecimal.valueOf(24_800), EXPIRY, BigDecimal.TEN, true))
                    .isSameAs(OptionGreeks.UNAVAILABLE);
        }

        @Test
        @DisplayName("A price below intrinsic cannot be solved")
        void belowIntrinsic() {
            assertThat(solver.solve(24_800, 24_000, YEARS, RATE, 100, true)).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("Greeks")
    class Greeks {

        @Test
        @DisplayName("Call delta is positive, put delta negative, both decay")
        void signs() {
            OptionGreeks call = calculator.calculate(
                    BigDecimal.valueOf(24_800), BigDecimal.valueOf(24_800), EXPIRY, bsPrice(24_800, 0.15, true), true);
            OptionGreeks put = calculator.calculate(
                    BigDecimal.valueOf(24_800), BigDecimal.valueOf(24_800), EXPIRY, bsPrice(24_800, 0.15, false), false);

            assertThat(call.getDelta().doubleValue()).isBetween(0.5, 0.6);
            assertThat(put.getDelta().doubleValue()).isBetween(-0.5, -0.4);
            assertThat(call.getDelta().subtract(put.getDelta()).doubleValue()).isCloseTo(1.0, within(0.001));
            assertThat(call.getTheta().signum()).isNegative();
            assertThat(put.getTheta().signum()).isNegative();
            assertThat(call.getGamma().doubleValue()).isCloseTo(put.getGamma().doubleValue(), within(1e-6));
            assertThat(call.getVega().signum()).isPositive();
        }

        @Test
        @DisplayName("calculateAll keys Greeks by quote key")
        void calculateAll() {
            EnrichedOption ce = Fixtures.enriched("NIFTY", EXPIRY, 24_800, OptionKind.CE,
                    bsPrice(24_800, 0.15, true).setScale(2, java.math.RoundingMode.HALF_UP).toPlainString(), 1000);
            EnrichedOption dead = Fixtures.enriched("NIFTY", EXPIRY, 26_000, OptionKind.CE, "0", 10);

            Map<String, OptionGreeks> all = calculator.calculateAll(BigDecimal.valueOf(24_800), EXPIRY, List.of(ce, dead));

            assertThat(all).containsOnlyKeys(ce.getKey(), dead.getKey());
            assertThat(all.get(ce.getKey()).isAvailable()).isTrue();
            assertThat(all.get(dead.getKey()).isAvailable()).isFalse();
        }
    }
}
