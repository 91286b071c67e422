package com.chaincollector.error;

/**
 * Where a handled error is surfaced.
 */
public enum ErrorDestination {
    LIVE_COLLECTION,
    ALERTS,
    BOTH;

    /**
     * Routing rule: CRITICAL severity goes to both destinations whatever the category;
     * otherwise data-collection categories go to LIVE_COLLECTION and the rest to ALERTS.
     */
    public static ErrorDestination route(ErrorCategory category, ErrorSeverity severity) {
        if (severity == ErrorSeverity.CRITICAL) {
            return BOTH;
        }
        return category.isLiveCollection() ? LIVE_COLLECTION : ALERTS;
    }

    public boolean reaches(ErrorDestination target) {
        return this == BOTH || this == target;
    }
}
