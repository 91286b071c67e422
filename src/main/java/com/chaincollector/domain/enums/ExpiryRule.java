package com.chaincollector.domain.enums;

import java.util.Arrays;

/**
 * Symbolic contract-expiry selector used in index configuration.
 *
 * <ul>
 *   <li>THIS_WEEK: nearest listed expiry</li>
 *   <li>NEXT_WEEK: the one after it</li>
 *   <li>THIS_MONTH: last expiry of the nearest month</li>
 *   <li>NEXT_MONTH: last expiry of the following month</li>
 * </ul>
 */
public enum ExpiryRule {
    THIS_WEEK("this_week"),
    NEXT_WEEK("next_week"),
    THIS_MONTH("this_month"),
    NEXT_MONTH("next_month");

    private final String code;

    ExpiryRule(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isWeekly() {
        return this == THIS_WEEK || this == NEXT_WEEK;
    }

    /** Accepts both the config code ("this_week") and the enum name ("THIS_WEEK"). */
    public static ExpiryRule fromCode(String value) {
        return Arrays.stream(values())
                .filter(r -> r.code.equalsIgnoreCase(value) || r.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown expiry rule: " + value));
    }

    @Override
    public String toString() {
        return code;
    }
}
