package com.parlayarchitect.domain.enums;

/**
 * Derived quality classification of a leg, ordered strongest first.
 *
 * <p>Tiers are never supplied by upstream. The {@code TierClassifier} computes them once per
 * request from the leg's quality signal, confidence and market category.
 */
public enum Tier {
    STRONG(1.00),
    MODERATE(0.70),
    WEAK(0.45);

    /** Base leg weight contributed by the tier before confidence and penalties. */
    private final double baseWeight;

    Tier(double baseWeight) {
        this.baseWeight = baseWeight;
    }

    public double getBaseWeight() {
        return baseWeight;
    }
}
