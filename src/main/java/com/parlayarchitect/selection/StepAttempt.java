package com.parlayarchitect.selection;

import com.parlayarchitect.rules.RelaxationStep;
import lombok.Value;

/**
 * Trace of one ladder rung: what the assembler managed and why the rung did or did not accept.
 */
@Value
public class StepAttempt {

    public enum Outcome {
        ACCEPTED,
        CONSTRAINT_BLOCKED,
        WEIGHT_TOO_LOW
    }

    RelaxationStep step;
    int legsAssembled;
    double aggregateWeight;
    double minAggregateWeight;
    Outcome outcome;
}
