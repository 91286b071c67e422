package com.chaincollector.analytics;

import com.chaincollector.domain.enums.OptionKind;
import com.chaincollector.domain.model.EnrichedOption;
import com.chaincollector.domain.model.Ohlc;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-expiry summary figures written to the overview snapshot.
 */
public final class ChainAnalytics {

    private ChainAnalytics() {}

    /** Total put OI over total call OI, 4 decimals; zero when there is no call OI. */
    public static BigDecimal putCallRatio(Collection<EnrichedOption> options) {
        long callOi = 0;
        long putOi = 0;
        for (EnrichedOption option : options) {
            if (option.getKind() == OptionKind.CE) {
                callOi += option.getOpenInterest();
            } else if (option.getKind() == OptionKind.PE) {
                putOi += option.getOpenInterest();
            }
        }
        if (callOi == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(putOi).divide(BigDecimal.valueOf(callOi), 4, RoundingMode.HALF_UP);
    }

    /** Day range (high minus low) of the index; empty unless strictly positive. */
    public static Optional<BigDecimal> dayWidth(Ohlc ohlc) {
        if (ohlc == null) {
            return Optional.empty();
        }
        BigDecimal range = ohlc.getRange();
        return range.signum() > 0 ? Optional.of(range) : Optional.empty();
    }

    /**
     * Intrinsic value, time value and OI share for options within {@code window} strikes of
     * {@code atm}, keyed by {@code exchange:tradingSymbol}. Options outside the window are left out.
     */
    public static Map<String, OptionMetrics> perOptionMetrics(
            Collection<EnrichedOption> options, BigDecimal spot, int atm, int step, int window) {
        long callOi = 0;
        long putOi = 0;
        for (EnrichedOption option : options) {
            if (option.getKind() == OptionKind.CE) {
                callOi += option.getOpenInterest();
            } else if (option.getKind() == OptionKind.PE) {
                putOi += option.getOpenInterest();
            }
        }
        Map<String, OptionMetrics> result = new LinkedHashMap<>();
        if (spot == null || step <= 0 || window <= 0) {
            return result;
        }
        BigDecimal reach = BigDecimal.valueOf((long) step * window);
        BigDecimal centre = BigDecimal.valueOf(atm);
        for (EnrichedOption option : options) {
            BigDecimal strike = option.getStrike();
            if (strike == null || option.getKind() == null
                    || strike.subtract(centre).abs().compareTo(reach) > 0) {
                continue;
            }
            boolean call = option.getKind() == OptionKind.CE;
            BigDecimal intrinsic = (call ? spot.subtract(strike) : strike.subtract(spot)).max(BigDecimal.ZERO);
            BigDecimal price = option.getQuote().getLastPrice();
            BigDecimal timeValue = price == null ? BigDecimal.ZERO : price.subtract(intrinsic).max(BigDecimal.ZERO);
            long sideOi = call ? callOi : putOi;
            BigDecimal share = sideOi == 0
                    ? BigDecimal.ZERO
                    : BigDecimal.valueOf(option.getOpenInterest()).divide(BigDecimal.valueOf(sideOi), 4, RoundingMode.HALF_UP);
            result.put(option.getKey(), OptionMetrics.builder()
                    .intrinsic(intrinsic)
                    .timeValue(timeValue)
                    .oiShare(share)
                    .build());
        }
        return result;
    }
}
