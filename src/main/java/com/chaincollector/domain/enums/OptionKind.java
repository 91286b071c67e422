package com.chaincollector.domain.enums;

/**
 * Side of an option contract. Maps to Kite's instrument_type field ("CE" / "PE").
 */
public enum OptionKind {
    CE,
    PE;

    /** Parses Kite's instrument_type; returns null for futures, equities and unknown types. */
    public static OptionKind fromKiteType(String kiteType) {
        if (kiteType == null || kiteType.isBlank()) {
            return null;
        }
        try {
            return OptionKind.valueOf(kiteType.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
