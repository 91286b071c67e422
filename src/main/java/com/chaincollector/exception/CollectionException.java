package com.chaincollector.exception;

import java.util.Map;

/**
 * Base type for per-stage collection failures (expiry resolution, empty instrument or quote
 * sets, sink writes). These are always routed and never abort a cycle.
 */
public abstract class CollectionException extends BaseException {

    protected CollectionException(String message, Map<String, Object> details) {
        super(ErrorCode.COLLECTION_ERROR, message, details);
    }

    protected CollectionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
