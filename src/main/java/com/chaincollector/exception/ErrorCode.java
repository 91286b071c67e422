package com.chaincollector.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    PROVIDER_ERROR("PROVIDER_ERROR", true),
    CREDENTIALS_ERROR("CREDENTIALS_ERROR", false),
    CIRCUIT_OPEN("CIRCUIT_OPEN", false),
    RETRY_EXHAUSTED("RETRY_EXHAUSTED", false),
    COLLECTION_ERROR("COLLECTION_ERROR", false),
    SINK_ERROR("SINK_ERROR", false),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", false);

    private final String code;

    /** Whether the failure originates upstream (broker side) rather than in this process. */
    private final boolean upstream;
}
