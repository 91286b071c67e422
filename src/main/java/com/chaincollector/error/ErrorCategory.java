package com.chaincollector.error;

/**
 * Classification buckets for handled errors.
 *
 * <p>Categories flagged {@code liveCollection} concern the upstream data path and are shown on
 * the live collection view; all others go to the general alerts view.
 */
public enum ErrorCategory {
    COLLECTOR(true),
    PROVIDER_API(true),
    NETWORK(true),
    DATA_VALIDATION(true),
    DATA_PARSING(true),
    DATA_COLLECTION(true),
    CALCULATION(false),
    TRANSFORMATION(false),
    ANALYTICS(false),
    FILE_IO(false),
    DATABASE(false),
    CSV_WRITE(false),
    BACKUP(false),
    CONFIGURATION(false),
    INITIALIZATION(false),
    RESOURCE(false),
    MEMORY(false),
    RENDERING(false),
    PANEL_DISPLAY(false),
    RICH_MARKUP(false),
    UNKNOWN(false),
    CRITICAL(false);

    private final boolean liveCollection;

    ErrorCategory(boolean liveCollection) {
        this.liveCollection = liveCollection;
    }

    public boolean isLiveCollection() {
        return liveCollection;
    }
}
