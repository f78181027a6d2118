package com.parlayarchitect.selection;

import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.rules.RelaxationStep;
import java.util.List;
import lombok.Value;

/**
 * Result of running the fallback ladder: either the accepting rung with its assembly, or an
 * exhausted ladder. Always carries the per-rung trace.
 */
@Value
public class LadderOutcome {

    /** Null when the ladder was exhausted. */
    RelaxationStep acceptedAt;

    /** Rule set of the accepting rung; null when exhausted. */
    RuleSet rulesApplied;

    /** Null when the ladder was exhausted. */
    Assembly assembly;

    List<StepAttempt> attempts;

    public boolean isAccepted() {
        return acceptedAt != null;
    }

    static LadderOutcome accepted(RelaxationStep step, RuleSet rules, Assembly assembly, List<StepAttempt> attempts) {
        return new LadderOutcome(step, rules, assembly, List.copyOf(attempts));
    }

    static LadderOutcome exhausted(List<StepAttempt> attempts) {
        return new LadderOutcome(null, null, null, List.copyOf(attempts));
    }
}
