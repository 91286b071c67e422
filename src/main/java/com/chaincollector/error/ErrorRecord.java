package com.chaincollector.error;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One handled error. Immutable; the destination is computed once when the record is built.
 */
@Value
@Builder
public class ErrorRecord {

    long id;
    Instant timestamp;

    @JsonIgnore
    Throwable exception;

    String exceptionType;
    String message;
    ErrorCategory category;
    ErrorSeverity severity;
    String component;
    String indexName;
    Long cycleId;
    Map<String, Object> context;
    ErrorDestination destination;
}
