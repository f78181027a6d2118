package com.parlayarchitect.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-profile selection constraints.
 *
 * <p>Rule sets are loaded once from configuration and never mutated. The fallback ladder derives
 * relaxed copies through {@link #toBuilder()}.
 *
 * <p>{@code minStrong} and {@code minModerate} are soft: the assembler reserves slots for them
 * when the pool can fill them and reports a shortfall otherwise. {@code allowWeak},
 * {@code maxHighVolatility} and {@code maxSameEvent} are enforced while assembling. No ladder
 * step relaxes the per-event limit.
 */
@Value
@Builder(toBuilder = true)
public class RuleSet {

    double minAggregateWeight;

    int minStrong;

    int minModerate;

    boolean allowWeak;

    int maxHighVolatility;

    /** Legs allowed from one event unless the request lifts the limit. */
    @Builder.Default
    int maxSameEvent = 1;

    /** Whether optional-category legs are included when the request does not say. */
    boolean includeOptionalCategory;
}
