package com.parlayarchitect.domain.enums;

/**
 * Ordinal volatility band of a leg. HIGH legs are capped per selection by the active rule set.
 */
public enum VolatilityClass {
    LOW(0.00),
    MEDIUM(0.06),
    HIGH(0.12);

    private final double weightPenalty;

    VolatilityClass(double weightPenalty) {
        this.weightPenalty = weightPenalty;
    }

    public double getWeightPenalty() {
        return weightPenalty;
    }
}
