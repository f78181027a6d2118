package com.parlayarchitect.domain.enums;

import java.util.Locale;

/**
 * Categorical quality state reported by the upstream scoring service for a leg.
 *
 * <p>Upstream states outside the known set (pending, no-play, blank) normalise to
 * {@link #UNDECIDED}, which always classifies as the weakest tier.
 */
public enum QualitySignal {
    STRONG,
    MEDIUM,
    WEAK,
    UNDECIDED;

    /**
     * Parses an upstream state label. Accepts the EDGE/PICK/LEAN vocabulary of the simulation feed as aliases.
     */
    public static QualitySignal fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNDECIDED;
        }
        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "STRONG", "EDGE" -> STRONG;
            case "MEDIUM", "PICK", "LEAN" -> MEDIUM;
            case "WEAK" -> WEAK;
            default -> UNDECIDED;
        };
    }
}
