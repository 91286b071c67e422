package com.chaincollector.exception;

import java.time.LocalDate;
import java.util.Map;

public class NoQuotesException extends CollectionException {

    public NoQuotesException(String index, LocalDate expiry, String rule, int instrumentCount) {
        super(
                "No quotes returned for " + index + " expiry " + expiry + " (rule: " + rule + "); instruments="
                        + instrumentCount,
                Map.of("index", index, "expiry", String.valueOf(expiry), "rule", rule, "instrumentCount",
                        instrumentCount));
    }
}
