package com.chaincollector.config;

import com.chaincollector.memory.PressureAction;
import com.chaincollector.memory.PressureTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Memory-pressure degradation, bound from {@code collector.memory.*}. With no tiers configured
 * the built-in normal/elevated/high/critical ladder applies.
 */
@Configuration
@ConfigurationProperties(prefix = "collector.memory")
@Validated
@Getter
@Setter
public class MemoryPressureProperties {

    private boolean enabled = true;

    /** EMA smoothing weight of the newest sample. */
    @DecimalMin("0.01")
    @DecimalMax("1.0")
    private double alpha = 0.4;

    @Min(0)
    private long recoverySeconds = 60;

    @Min(0)
    private long rollbackCooldownSeconds = 120;

    /** Strikes each side of ATM that get per-option metrics at low pressure. */
    @Min(1)
    private int atmMetricWindow = 5;

    @Valid
    private List<Tier> tiers = new ArrayList<>();

    public List<PressureTier> toPressureTiers() {
        if (tiers.isEmpty()) {
            return PressureTier.defaults();
        }
        List<PressureTier> result = new ArrayList<>(tiers.size());
        for (Tier tier : tiers) {
            Set<PressureAction> actions = tier.getActions().isEmpty()
                    ? EnumSet.noneOf(PressureAction.class)
                    : EnumSet.copyOf(tier.getActions());
            result.add(new PressureTier(tier.getName(), tier.getLevel(), tier.getThreshold(), actions));
        }
        return result;
    }

    @Getter
    @Setter
    public static class Tier {

        @NotBlank
        private String name;

        @Min(0)
        private int level;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double threshold;

        private List<PressureAction> actions = new ArrayList<>();
    }
}
