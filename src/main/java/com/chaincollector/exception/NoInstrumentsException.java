package com.chaincollector.exception;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public class NoInstrumentsException extends CollectionException {

    public NoInstrumentsException(String index, LocalDate expiry, String rule, List<Integer> strikes) {
        super(
                "No instruments for " + index + " expiry " + expiry + " (rule: " + rule + ") with strikes="
                        + strikes,
                Map.of("index", index, "expiry", String.valueOf(expiry), "rule", rule, "strikes", strikes));
    }
}
