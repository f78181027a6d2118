package com.parlayarchitect.rules;

import com.parlayarchitect.domain.enums.RiskProfile;
import com.parlayarchitect.domain.model.RuleSet;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of everything the engine reads from configuration.
 *
 * <p>Built once by the configuration loader and published through {@link ConfigurationHolder}.
 * A request reads the snapshot exactly once, so a concurrent reload never mixes old and new
 * values within one selection.
 */
@Value
@Builder
public class ArchitectConfiguration {

    TierThresholds tierThresholds;

    Map<RiskProfile, RuleSet> ruleSets;

    FallbackLadder fallbackLadder;

    /** Upper bound on the requested leg count. */
    int maxLegs;

    public Optional<RuleSet> ruleSetFor(RiskProfile profile) {
        return Optional.ofNullable(ruleSets.get(profile));
    }
}
