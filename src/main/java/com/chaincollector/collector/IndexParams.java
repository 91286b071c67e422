package com.chaincollector.collector;

import com.chaincollector.domain.enums.ExpiryRule;
import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Per-index collection settings, bound from {@code collector.indices.<SYMBOL>}.
 */
@Getter
@Setter
public class IndexParams {

    private boolean enabled = true;

    /** Expiry rules collected each cycle, in order: this_week, next_week, this_month, next_month. */
    private List<ExpiryRule> expiries = new ArrayList<>(List.of(ExpiryRule.THIS_WEEK));

    @Min(0)
    private int strikesItm = 10;

    @Min(0)
    private int strikesOtm = 10;

    public IndexParams() {}

    public static IndexParams of(List<ExpiryRule> expiries, int strikesItm, int strikesOtm) {
        IndexParams params = new IndexParams();
        params.setExpiries(new ArrayList<>(expiries));
        params.setStrikesItm(strikesItm);
        params.setStrikesOtm(strikesOtm);
        return params;
    }

    public static IndexParams disabled() {
        IndexParams params = new IndexParams();
        params.setEnabled(false);
        return params;
    }
}
