package com.chaincollector.analytics;

import com.chaincollector.domain.enums.OptionKind;
import com.chaincollector.domain.model.EnrichedOption;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Black-Scholes Greeks for index options (no dividend yield).
 *
 * <p>IV is solved from the option's last price, then delta, gamma, theta and vega follow
 * analytically. Time to expiry runs to 15:30 exchange time on the expiry date and is floored at
 * one minute.
 */
public class GreeksCalculator {

    private static final Logger log = LoggerFactory.getLogger(GreeksCalculator.class);

    private static final double MINUTES_PER_YEAR = 525_600.0;
    private static final LocalTime EXPIRY_CLOSE = LocalTime.of(15, 30);
    private static final NormalDistribution NORM = new NormalDistribution();

    private final ImpliedVolatilitySolver solver;
    private final double riskFreeRate;
    private final ZoneId zone;
    private final Clock clock;

    public GreeksCalculator(ImpliedVolatilitySolver solver, double riskFreeRate, ZoneId zone, Clock clock) {
        this.solver = solver;
        this.riskFreeRate = riskFreeRate;
        this.zone = zone;
        this.clock = clock;
    }

    public OptionGreeks calculate(BigDecimal spot, BigDecimal strike, LocalDate expiry, BigDecimal price, boolean call) {
        if (spot == null || strike == null || price == null || expiry == null) {
            return OptionGreeks.UNAVAILABLE;
        }
        double s = spot.doubleValue();
        double k = strike.doubleValue();
        double t = yearsToExpiry(expiry);
        double iv = solver.solve(s, k, t, riskFreeRate, price.doubleValue(), call);
        if (iv < 0) {
            return OptionGreeks.UNAVAILABLE;
        }
        return fromVolatility(s, k, t, iv, call);
    }

    /**
     * Greeks for every option of one expiry, keyed by {@code exchange:tradingSymbol}. Options
     * whose IV cannot be solved map to {@link OptionGreeks#UNAVAILABLE}.
     */
    public Map<String, OptionGreeks> calculateAll(BigDecimal spot, LocalDate expiry, List<EnrichedOption> options) {
        Map<String, OptionGreeks> result = new LinkedHashMap<>();
        int unavailable = 0;
        for (EnrichedOption option : options) {
            OptionGreeks greeks = calculate(
                    spot,
                    option.getStrike(),
                    expiry,
                    option.getQuote().getLastPrice(),
                    option.getKind() == OptionKind.CE);
            if (!greeks.isAvailable()) {
                unavailable++;
            }
            result.put(option.getKey(), greeks);
        }
        if (unavailable > 0) {
            log.debug("Greeks unavailable for {} of {} options expiring {}", unavailable, options.size(), expiry);
        }
        return result;
    }

    double yearsToExpiry(LocalDate expiry) {
        LocalDateTime now = LocalDateTime.now(clock.withZone(zone));
        long minutes = ChronoUnit.MINUTES.between(now, expiry.atTime(EXPIRY_CLOSE));
        return Math.max(minutes, 1) / MINUTES_PER_YEAR;
    }

    // ---- Private helpers ----

    private OptionGreeks fromVolatility(double s, double k, double t, double iv, boolean call) {
        double sqrtT = Math.sqrt(t);
        double d1 = (Math.log(s / k) + (riskFreeRate + iv * iv / 2.0) * t) / (iv * sqrtT);
        double d2 = d1 - iv * sqrtT;
        double pdf = NORM.density(d1);
        double discount = Math.exp(-riskFreeRate * t);

        double delta = call ? NORM.cumulativeProbability(d1) : NORM.cumulativeProbability(d1) - 1.0;
        double decay = -s * pdf * iv / (2.0 * sqrtT);
        double carry = call
                ? -riskFreeRate * k * discount * NORM.cumulativeProbability(d2)
                : riskFreeRate * k * discount * NORM.cumulativeProbability(-d2);
        double theta = (decay + carry) / 365.0;
        double gamma = pdf / (s * iv * sqrtT);
        double vega = s * pdf * sqrtT / 100.0;

        return OptionGreeks.builder()
                .delta(BigDecimal.valueOf(delta).setScale(4, RoundingMode.HALF_UP))
                .gamma(BigDecimal.valueOf(gamma).setScale(6, RoundingMode.HALF_UP))
                .theta(BigDecimal.valueOf(theta).setScale(2, RoundingMode.HALF_UP))
                .vega(BigDecimal.valueOf(vega).setScale(2, RoundingMode.HALF_UP))
                .iv(BigDecimal.valueOf(iv * 100).setScale(2, RoundingMode.HALF_UP))
                .build();
    }
}
