package com.parlayarchitect.selection;

import com.parlayarchitect.domain.model.RankedLeg;
import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.rules.RelaxationStep;
import java.util.List;
import lombok.Value;

/**
 * A candidate selection built under one rung's rule set. May hold fewer legs than requested
 * when the constraints could not be filled.
 */
@Value
public class Assembly {

    RelaxationStep builtAt;
    RuleSet rules;

    /** Legs in rank order. */
    List<RankedLeg> legs;

    double aggregateWeight;

    public boolean isComplete(int legCount) {
        return legs.size() == legCount;
    }
}
