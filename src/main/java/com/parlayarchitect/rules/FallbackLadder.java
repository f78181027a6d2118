package com.parlayarchitect.rules;

import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Expands a base {@link RuleSet} into the cumulative sequence of relaxed rule sets, one per
 * {@link RelaxationStep}.
 *
 * <p>The two weight deltas are configurable; the second one must be strictly larger than the
 * first.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FallbackLadder {

    private final double firstWeightDelta;
    private final double secondWeightDelta;

    public FallbackLadder(double firstWeightDelta, double secondWeightDelta) {
        if (firstWeightDelta < 0.0 || secondWeightDelta < 0.0) {
            throw new ConfigurationException(
                    "Ladder weight deltas must not be negative",
                    Map.of("firstWeightDelta", firstWeightDelta, "secondWeightDelta", secondWeightDelta));
        }
        if (secondWeightDelta <= firstWeightDelta) {
            throw new ConfigurationException(
                    "Second ladder weight delta must be larger than the first",
                    Map.of("firstWeightDelta", firstWeightDelta, "secondWeightDelta", secondWeightDelta));
        }
        this.firstWeightDelta = firstWeightDelta;
        this.secondWeightDelta = secondWeightDelta;
    }

    /**
     * Returns one rule set per relaxation step, index-aligned with {@link RelaxationStep#values()}.
     */
    public List<RuleSet> expand(RuleSet base) {
        List<RuleSet> rungs = new ArrayList<>(RelaxationStep.values().length);
        RuleSet current = base;
        for (RelaxationStep step : RelaxationStep.values()) {
            current = step.relax(current, this);
            rungs.add(current);
        }
        return Collections.unmodifiableList(rungs);
    }

    public int stepCount() {
        return RelaxationStep.values().length;
    }
}
