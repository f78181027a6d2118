package com.parlayarchitect.rules;

import com.parlayarchitect.domain.model.RuleSet;

/**
 * The fixed, ordered rungs of the fallback ladder.
 *
 * <p>Each rung loosens exactly one constraint relative to the rung before it. The ladder applies
 * them cumulatively, so the rule set of rung K is never stricter than that of rung K-1.
 */
public enum RelaxationStep {

    AS_CONFIGURED("rule set as configured") {
        @Override
        RuleSet relax(RuleSet previous, FallbackLadder ladder) {
            return previous;
        }
    },

    LOWER_WEIGHT("lower minimum aggregate weight") {
        @Override
        RuleSet relax(RuleSet previous, FallbackLadder ladder) {
            return previous.toBuilder()
                    .minAggregateWeight(Math.max(0.0, previous.getMinAggregateWeight() - ladder.getFirstWeightDelta()))
                    .build();
        }
    },

    EXTRA_HIGH_VOLATILITY("allow one more HIGH volatility leg") {
        @Override
        RuleSet relax(RuleSet previous, FallbackLadder ladder) {
            return previous.toBuilder()
                    .maxHighVolatility(previous.getMaxHighVolatility() + 1)
                    .build();
        }
    },

    RELAX_TIER_MINIMUMS("relax soft tier minimums by one") {
        @Override
        RuleSet relax(RuleSet previous, FallbackLadder ladder) {
            return previous.toBuilder()
                    .minStrong(Math.max(0, previous.getMinStrong() - 1))
                    .minModerate(Math.max(0, previous.getMinModerate() - 1))
                    .build();
        }
    },

    PERMIT_WEAK("permit WEAK tier legs") {
        @Override
        RuleSet relax(RuleSet previous, FallbackLadder ladder) {
            return previous.toBuilder().allowWeak(true).build();
        }
    },

    LOWER_WEIGHT_FURTHER("lower minimum aggregate weight further") {
        @Override
        RuleSet relax(RuleSet previous, FallbackLadder ladder) {
            return previous.toBuilder()
                    .minAggregateWeight(
                            Math.max(0.0, previous.getMinAggregateWeight() - ladder.getSecondWeightDelta()))
                    .build();
        }
    };

    private final String description;

    RelaxationStep(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public int getIndex() {
        return ordinal();
    }

    abstract RuleSet relax(RuleSet previous, FallbackLadder ladder);
}
