package com.parlayarchitect.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of risk profiles. Each profile maps to exactly one configured rule set.
 */
public enum RiskProfile {
    PREMIUM,
    BALANCED,
    SPECULATIVE;

    /** Case-insensitive lookup. Empty for blank or unknown names. */
    public static Optional<RiskProfile> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (RiskProfile profile : values()) {
            if (profile.name().equals(normalized)) {
                return Optional.of(profile);
            }
        }
        return Optional.empty();
    }
}
