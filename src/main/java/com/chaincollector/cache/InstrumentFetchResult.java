package com.chaincollector.cache;

import com.chaincollector.domain.model.Instrument;
import java.util.List;
import lombok.Value;

@Value
public class InstrumentFetchResult {

    List<Instrument> instruments;
    boolean fromCache;

    public boolean isEmpty() {
        return instruments.isEmpty();
    }
}
