package com.chaincollector.expiry;

import java.util.List;
import java.util.TreeSet;

/**
 * Strike arithmetic around the at-the-money strike.
 */
public final class StrikeLadder {

    private static final double WIDE_STEP_ABOVE = 20_000;

    private StrikeLadder() {}

    /**
     * Rounds a spot price to the nearest strike: step 100 above 20000, otherwise 50.
     */
    public static int atmFromPrice(double price) {
        if (price <= 0) {
            return 0;
        }
        int step = price > WIDE_STEP_ABOVE ? 100 : 50;
        return (int) (Math.round(price / step) * step);
    }

    /**
     * Builds {@code itm + 1 + otm} strikes centred on {@code atm}, spaced by {@code step}, sorted
     * ascending.
     *
     * <p>A {@code scale} below 1 shrinks both sides to {@code max(1, round(n * scale))}. An
     * ATM of zero or less yields an empty ladder.
     */
    public static List<Integer> build(int atm, int itm, int otm, int step, double scale) {
        if (atm <= 0 || step <= 0) {
            return List.of();
        }
        int below = scaled(itm, scale);
        int above = scaled(otm, scale);
        TreeSet<Integer> strikes = new TreeSet<>();
        for (int i = 1; i <= below; i++) {
            int strike = atm - i * step;
            if (strike > 0) {
                strikes.add(strike);
            }
        }
        strikes.add(atm);
        for (int i = 1; i <= above; i++) {
            strikes.add(atm + i * step);
        }
        return List.copyOf(strikes);
    }

    public static List<Integer> build(int atm, int itm, int otm, int step) {
        return build(atm, itm, otm, step, 1.0);
    }

    private static int scaled(int count, double scale) {
        if (count <= 0) {
            return 0;
        }
        if (scale >= 1.0 || scale <= 0) {
            return count;
        }
        return Math.max(1, (int) Math.round(count * scale));
    }
}
