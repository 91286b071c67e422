package com.chaincollector.exception;

import java.util.Map;

public class ResolveExpiryException extends CollectionException {

    public ResolveExpiryException(String index, String rule, String reason) {
        super(
                "Failed to resolve expiry for " + index + " using rule '" + rule + "': " + reason,
                Map.of("index", index, "rule", rule));
    }
}
