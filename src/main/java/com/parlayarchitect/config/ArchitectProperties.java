package com.parlayarchitect.config;

import com.parlayarchitect.domain.enums.MarketCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the parlay architect, loaded from application.yml.
 *
 * <p>Properties prefix: {@code parlay.architect.*}. These are raw, mutable binding targets;
 * {@link ArchitectConfigurationLoader} validates them and freezes them into an immutable
 * {@code ArchitectConfiguration} at startup.
 *
 * <p>Profile keys are risk profile names (premium, balanced, speculative).
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "parlay.architect")
public class ArchitectProperties {

    /** Largest leg count a request may ask for. */
    @Min(1)
    private int maxLegs = 12;

    /** Confidence cutoff per category for promoting MEDIUM signals to MODERATE. */
    @NotEmpty
    private Map<MarketCategory, Double> categoryThresholds = new EnumMap<>(MarketCategory.class);

    @NotEmpty
    @Valid
    private Map<String, ProfileProperties> profiles = new LinkedHashMap<>();

    @Valid
    private LadderProperties ladder = new LadderProperties();

    @Data
    public static class ProfileProperties {

        @NotNull
        @DecimalMin("0.0")
        private Double minAggregateWeight;

        @Min(0)
        private int minStrong;

        @Min(0)
        private int minModerate;

        private boolean allowWeak = true;

        @Min(0)
        private int maxHighVolatility;

        @Min(1)
        private int maxSameEvent = 1;

        private boolean includeOptionalCategory = false;
    }

    @Data
    public static class LadderProperties {

        /** Weight floor reduction applied at step 1. */
        @DecimalMin("0.0")
        private double firstWeightDelta = 0.15;

        /** Additional weight floor reduction applied at step 5. */
        @DecimalMin("0.0")
        private double secondWeightDelta = 0.30;
    }
}
