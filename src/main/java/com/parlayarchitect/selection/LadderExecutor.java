package com.parlayarchitect.selection;

import com.parlayarchitect.domain.model.RankedLeg;
import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.rules.FallbackLadder;
import com.parlayarchitect.rules.RelaxationStep;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the fallback ladder: a bounded, strictly sequential search over the relaxation steps.
 *
 * <p>For each rung K (in order, stopping at the first acceptance):
 * <ol>
 *   <li>assemble a selection under rung K's rule set</li>
 *   <li>consider every complete assembly built so far (rungs 0..K) whose aggregate weight meets
 *       rung K's floor</li>
 *   <li>accept the heaviest of them, the earliest rung winning an exact tie</li>
 * </ol>
 * Because rung K's rules are never stricter than those of earlier rungs, any assembly valid at
 * an earlier rung is valid at K too. Reconsidering them keeps relaxation monotonic even where
 * the greedy assembler picks differently under looser rules.
 *
 * <p>Stateless; every call works on its own copies.
 */
@Component
public class LadderExecutor {

    private static final Logger log = LoggerFactory.getLogger(LadderExecutor.class);

    private final SelectionAssembler selectionAssembler;

    public LadderExecutor(SelectionAssembler selectionAssembler) {
        this.selectionAssembler = selectionAssembler;
    }

    /**
     * @param rankedPool eligible legs sorted by {@code ranking}
     * @param baseRules the profile's rule set as configured
     * @param ladder relaxation settings
     * @param legCount number of legs to select
     * @param allowSameEntity whether the correlation guard is bypassed
     * @param allowSameEvent whether the per-event leg limit is lifted
     * @param ranking request-scoped leg order
     */
    public LadderOutcome execute(
            List<RankedLeg> rankedPool,
            RuleSet baseRules,
            FallbackLadder ladder,
            int legCount,
            boolean allowSameEntity,
            boolean allowSameEvent,
            Comparator<RankedLeg> ranking) {
        List<RuleSet> rungs = ladder.expand(baseRules);
        List<Assembly> assemblies = new ArrayList<>(rungs.size());
        List<StepAttempt> attempts = new ArrayList<>(rungs.size());

        for (RelaxationStep step : RelaxationStep.values()) {
            RuleSet rules = rungs.get(step.getIndex());
            Assembly current =
                    selectionAssembler.assemble(
                    step, rankedPool, rules, legCount, allowSameEntity, allowSameEvent, ranking);
            assemblies.add(current);

            Assembly best = bestQualifying(assemblies, rules, legCount);
            StepAttempt attempt = new StepAttempt(
                    step,
                    current.getLegs().size(),
                    best != null ? best.getAggregateWeight() : current.getAggregateWeight(),
                    rules.getMinAggregateWeight(),
                    best != null
                            ? StepAttempt.Outcome.ACCEPTED
                            : current.isComplete(legCount)
                                    ? StepAttempt.Outcome.WEIGHT_TOO_LOW
                                    : StepAttempt.Outcome.CONSTRAINT_BLOCKED);
            attempts.add(attempt);

            log.debug(
                    "Ladder step {} ({}): assembled {}/{} legs, weight {} vs floor {} -> {}",
                    step.getIndex(),
                    step.getDescription(),
                    attempt.getLegsAssembled(),
                    legCount,
                    attempt.getAggregateWeight(),
                    attempt.getMinAggregateWeight(),
                    attempt.getOutcome());

            if (best != null) {
                return LadderOutcome.accepted(step, rules, best, attempts);
            }
        }
        return LadderOutcome.exhausted(attempts);
    }

    private Assembly bestQualifying(List<Assembly> assemblies, RuleSet rules, int legCount) {
        Assembly best = null;
        for (Assembly assembly : assemblies) {
            if (!assembly.isComplete(legCount) || !(assembly.getAggregateWeight() >= rules.getMinAggregateWeight())) {
                continue;
            }
            if (best == null || assembly.getAggregateWeight() > best.getAggregateWeight()) {
                best = assembly;
            }
        }
        return best;
    }
}
