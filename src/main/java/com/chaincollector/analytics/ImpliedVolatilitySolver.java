package com.chaincollector.analytics;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Implied volatility from an observed option price.
 *
 * <p>Newton-Raphson on the Black-Scholes price with vega as the derivative; when vega collapses
 * (deep ITM/OTM) or the iteration does not settle, falls back to bisection over
 * [0.001, 5.0]. Results outside [1%, 200%] are clamped. A price that no volatility in the
 * bisection range can produce yields {@code -1}.
 *
 * <p>Stateless and thread-safe.
 */
@Slf4j
public class ImpliedVolatilitySolver {

    private static final double INITIAL_GUESS = 0.25;
    private static final double TOLERANCE = 0.0001;
    private static final int NEWTON_MAX_ITERATIONS = 100;

    private static final double BISECTION_LOWER = 0.001;
    private static final double BISECTION_UPPER = 5.0;
    private static final int BISECTION_MAX_ITERATIONS = 200;

    static final double IV_MIN = 0.01;
    static final double IV_MAX = 2.0;

    private static final NormalDistribution NORM = new NormalDistribution();

    /**
     * @param spot underlying price
     * @param strike option strike
     * @param years time to expiry in years, must be positive
     * @param rate risk-free rate as a decimal
     * @param price observed option price
     * @return implied volatility as a decimal, or -1 when unsolvable
     */
    public double solve(double spot, double strike, double years, double rate, double price, boolean call) {
        if (price <= 0 || spot <= 0 || strike <= 0 || years <= 0) {
            return -1;
        }
        Double newton = newton(spot, strike, years, rate, price, call);
        double iv = newton != null ? newton : bisect(spot, strike, years, rate, price, call);
        if (iv < 0) {
            return -1;
        }
        return clamp(iv);
    }

    public double price(double spot, double strike, double years, double rate, double sigma, boolean call) {
        double sqrtT = Math.sqrt(years);
        double d1 = (Math.log(spot / strike) + (rate + sigma * sigma / 2.0) * years) / (sigma * sqrtT);
        double d2 = d1 - sigma * sqrtT;
        double discount = Math.exp(-rate * years);
        if (call) {
            return spot * NORM.cumulativeProbability(d1) - strike * discount * NORM.cumulativeProbability(d2);
        }
        return strike * discount * NORM.cumulativeProbability(-d2) - spot * NORM.cumulativeProbability(-d1);
    }

    // ---- Private helpers ----

    private Double newton(double spot, double strike, double years, double rate, double price, boolean call) {
        double sigma = INITIAL_GUESS;
        double sqrtT = Math.sqrt(years);
        for (int i = 0; i < NEWTON_MAX_ITERATIONS; i++) {
            double diff = price(spot, strike, years, rate, sigma, call) - price;
            if (Math.abs(diff) < TOLERANCE) {
                return sigma;
            }
            double d1 = (Math.log(spot / strike) + (rate + sigma * sigma / 2.0) * years) / (sigma * sqrtT);
            double vega = spot * NORM.density(d1) * sqrtT;
            if (Math.abs(vega) < 1e-10) {
                return null;
            }
            sigma = Math.max(BISECTION_LOWER, Math.min(BISECTION_UPPER, sigma - diff / vega));
        }
        return null;
    }

    private double bisect(double spot, double strike, double years, double rate, double price, boolean call) {
        double lower = BISECTION_LOWER;
        double upper = BISECTION_UPPER;
        double lowerPrice = price(spot, strike, years, rate, lower, call);
        double upperPrice = price(spot, strike, years, rate, upper, call);
        if (price < lowerPrice || price > upperPrice) {
            log.debug("Price {} outside achievable range [{}, {}] for K={}", price, lowerPrice, upperPrice, strike);
            return -1;
        }
        for (int i = 0; i < BISECTION_MAX_ITERATIONS; i++) {
            double mid = (lower + upper) / 2.0;
            double midPrice = price(spot, strike, years, rate, mid, call);
            if (Math.abs(midPrice - price) < TOLERANCE) {
                return mid;
            }
            if (midPrice > price) {
                upper = mid;
            } else {
                lower = mid;
            }
        }
        return (lower + upper) / 2.0;
    }

    private static double clamp(double iv) {
        if (iv < IV_MIN || iv > IV_MAX) {
            log.debug("Implied volatility {}% outside sane range, clamping", iv * 100);
            return Math.max(IV_MIN, Math.min(iv, IV_MAX));
        }
        return iv;
    }
}
