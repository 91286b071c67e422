package com.chaincollector.collector;

import com.chaincollector.domain.enums.ExpiryRule;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class IndexCollectionOutcome {

    String index;
    CollectionStatus status;

    @Singular
    List<ExpiryRule> writtenRules;

    @Singular
    List<StageResult.Failure<?>> failures;

    @Singular("pcr")
    Map<ExpiryRule, BigDecimal> pcrByRule;

    int optionsWritten;

    public static IndexCollectionOutcome of(String index, CollectionStatus status, StageResult.Failure<?> failure) {
        IndexCollectionOutcomeBuilder builder = IndexCollectionOutcome.builder().index(index).status(status);
        if (failure != null) {
            builder.failure(failure);
        }
        return builder.build();
    }
}
