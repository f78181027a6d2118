package com.parlayarchitect.config;

import com.parlayarchitect.domain.enums.RiskProfile;
import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.exception.ConfigurationException;
import com.parlayarchitect.mapper.RuleSetMapper;
import com.parlayarchitect.rules.ArchitectConfiguration;
import com.parlayarchitect.rules.FallbackLadder;
import com.parlayarchitect.rules.TierThresholds;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns bound {@link ArchitectProperties} into a validated, immutable
 * {@link ArchitectConfiguration}.
 *
 * <p>Any inconsistency raises {@link ConfigurationException}. Called from
 * {@link ArchitectConfig} during context startup, so a bad configuration stops the process
 * before it can serve a request. Reloads go through the same path.
 *
 * <p>Checks (beyond the Bean Validation annotations):
 * <ul>
 *   <li>every market category has a threshold in (0,1]</li>
 *   <li>every profile key names a known risk profile</li>
 *   <li>ladder deltas are non-negative and the second exceeds the first</li>
 * </ul>
 * Profiles absent from configuration are allowed; requests for them are rejected as invalid.
 */
public class ArchitectConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ArchitectConfigurationLoader.class);

    private final RuleSetMapper ruleSetMapper = Mappers.getMapper(RuleSetMapper.class);

    public ArchitectConfiguration load(ArchitectProperties properties) {
        if (properties.getMaxLegs() < 1) {
            throw new ConfigurationException(
                    "max-legs must be at least 1", Map.of("maxLegs", properties.getMaxLegs()));
        }

        TierThresholds tierThresholds = TierThresholds.of(properties.getCategoryThresholds());
        Map<RiskProfile, RuleSet> ruleSets = loadRuleSets(properties.getProfiles());
        FallbackLadder ladder = new FallbackLadder(
                properties.getLadder().getFirstWeightDelta(),
                properties.getLadder().getSecondWeightDelta());

        for (RiskProfile profile : RiskProfile.values()) {
            if (!ruleSets.containsKey(profile)) {
                log.warn("No rule set configured for profile {}; requests for it will be rejected", profile);
            }
        }

        log.info(
                "Architect configuration loaded: profiles={}, thresholds={}, ladder={}, maxLegs={}",
                ruleSets.keySet(),
                tierThresholds.asMap(),
                ladder,
                properties.getMaxLegs());

        return ArchitectConfiguration.builder()
                .tierThresholds(tierThresholds)
                .ruleSets(ruleSets)
                .fallbackLadder(ladder)
                .maxLegs(properties.getMaxLegs())
                .build();
    }

    private Map<RiskProfile, RuleSet> loadRuleSets(Map<String, ArchitectProperties.ProfileProperties> profiles) {
        if (profiles == null || profiles.isEmpty()) {
            throw new ConfigurationException("No risk profiles configured");
        }
        Map<RiskProfile, RuleSet> ruleSets = new EnumMap<>(RiskProfile.class);
        profiles.forEach((name, profileProperties) -> {
            RiskProfile profile = RiskProfile.fromName(name)
                    .orElseThrow(() -> new ConfigurationException(
                            "Unknown risk profile in configuration: " + name,
                            Map.of("profile", name, "allowed", Arrays.toString(RiskProfile.values()))));
            if (profileProperties == null || profileProperties.getMinAggregateWeight() == null) {
                throw new ConfigurationException(
                        "Profile " + name + " has no min-aggregate-weight", Map.of("profile", name));
            }
            RuleSet ruleSet = ruleSetMapper.toRuleSet(profileProperties);
            if (ruleSet.getMinAggregateWeight() < 0.0
                    || ruleSet.getMinStrong() < 0
                    || ruleSet.getMinModerate() < 0
                    || ruleSet.getMaxHighVolatility() < 0) {
                throw new ConfigurationException(
                        "Profile " + name + " has negative limits", Map.of("profile", name));
            }
            if (ruleSet.getMaxSameEvent() < 1) {
                throw new ConfigurationException(
                        "Profile " + name + " must allow at least one leg per event",
                        Map.of("profile", name, "maxSameEvent", ruleSet.getMaxSameEvent()));
            }
            if (ruleSets.put(profile, ruleSet) != null) {
                throw new ConfigurationException(
                        "Risk profile configured twice: " + profile, Map.of("profile", name));
            }
        });
        return Collections.unmodifiableMap(ruleSets);
    }
}
