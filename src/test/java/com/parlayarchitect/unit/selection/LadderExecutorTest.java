package com.parlayarchitect.unit.selection;

import static com.parlayarchitect.unit.fixtures.ArchitectFixtures.rules;
import static com.parlayarchitect.unit.fixtures.LegFixtures.leg;
import static com.parlayarchitect.unit.fixtures.LegFixtures.ranked;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.parlayarchitect.correlation.CorrelationGuard;
import com.parlayarchitect.domain.enums.Tier;
import com.parlayarchitect.domain.enums.VolatilityClass;
import com.parlayarchitect.domain.model.RankedLeg;
import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.rules.FallbackLadder;
import com.parlayarchitect.rules.RelaxationStep;
import com.parlayarchitect.scoring.WeightCalculator;
import com.parlayarchitect.selection.LadderExecutor;
import com.parlayarchitect.selection.LadderOutcome;
import com.parlayarchitect.selection.LegRanking;
import com.parlayarchitect.selection.SelectionAssembler;
import com.parlayarchitect.selection.StepAttempt;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for LadderExecutor: rung order, acceptance criteria and monotonic relaxation.
 *
 * <p>The shared pool has a light STRONG leg with HIGH volatility that ranks above a heavier
 * MODERATE leg. Once the HIGH volatility cap is raised the greedy assembly swaps the MODERATE
 * leg for it and gets lighter.
 */
class LadderExecutorTest {

    // ln(2.455) + ln(2.3175)
    private static final double STRONG_PLUS_MODERATE = Math.log(2.455) + Math.log(2.3175);

    private final SelectionAssembler assembler =
            new SelectionAssembler(new CorrelationGuard(), new WeightCalculator());
    private final LadderExecutor ladderExecutor = new LadderExecutor(assembler);

    private final List<RankedLeg> pool = List.of(
            ranked(leg("S1").build(), Tier.STRONG, 1.455),
            ranked(leg("S2").volatility(VolatilityClass.HIGH).build(), Tier.STRONG, 0.945),
            ranked(leg("M1").build(), Tier.MODERATE, 1.3175));

    private LadderOutcome run(RuleSet base, FallbackLadder ladder, int legCount) {
        return run(pool, base, ladder, legCount);
    }

    private LadderOutcome run(List<RankedLeg> candidates, RuleSet base, FallbackLadder ladder, int legCount) {
        Comparator<RankedLeg> ranking = LegRanking.forPool(candidates, 7L).comparator();
        List<RankedLeg> sorted = new ArrayList<>(candidates);
        sorted.sort(ranking);
        return ladderExecutor.execute(sorted, base, ladder, legCount, false, false, ranking);
    }

    @Nested
    @DisplayName("Acceptance")
    class Acceptance {

        @Test
        @DisplayName("Accepts at step 0 when the configured rules are met")
        void acceptsImmediately() {
            LadderOutcome outcome = run(rules(1.0, 0, 0, true, 0), new FallbackLadder(0.15, 0.30), 2);

            assertThat(outcome.isAccepted()).isTrue();
            assertThat(outcome.getAcceptedAt()).isEqualTo(RelaxationStep.AS_CONFIGURED);
            assertThat(outcome.getAssembly().getLegs()).extracting(RankedLeg::getId).containsExactly("S1", "M1");
            assertThat(outcome.getAttempts()).hasSize(1);
        }

        @Test
        @DisplayName("Lowered floor accepts the step 0 assembly, earliest rung wins the tie")
        void acceptsAtLowerWeight() {
            LadderOutcome outcome = run(rules(1.80, 0, 0, true, 0), new FallbackLadder(0.15, 0.30), 2);

            assertThat(outcome.getAcceptedAt()).isEqualTo(RelaxationStep.LOWER_WEIGHT);
            assertThat(outcome.getAssembly().getBuiltAt()).isEqualTo(RelaxationStep.AS_CONFIGURED);
            assertThat(outcome.getRulesApplied().getMinAggregateWeight()).isCloseTo(1.65, within(1e-9));
            assertThat(outcome.getAttempts())
                    .extracting(StepAttempt::getOutcome)
                    .containsExactly(StepAttempt.Outcome.WEIGHT_TOO_LOW, StepAttempt.Outcome.ACCEPTED);
        }
    }

    @Nested
    @DisplayName("Monotonic relaxation")
    class Monotonic {

        @Test
        @DisplayName("A heavier assembly from an earlier rung is still accepted after looser rules pick worse")
        void earlierAssemblyReconsidered() {
            LadderOutcome outcome = run(rules(1.90, 0, 0, true, 0), new FallbackLadder(0.0, 0.30), 2);

            assertThat(outcome.getAcceptedAt()).isEqualTo(RelaxationStep.LOWER_WEIGHT_FURTHER);
            assertThat(outcome.getAssembly().getBuiltAt()).isEqualTo(RelaxationStep.AS_CONFIGURED);
            assertThat(outcome.getAssembly().getLegs()).extracting(RankedLeg::getId).containsExactly("S1", "M1");
            assertThat(outcome.getAssembly().getAggregateWeight()).isCloseTo(STRONG_PLUS_MODERATE, within(1e-9));
            assertThat(outcome.getAttempts()).hasSize(6);
        }

        @Test
        @DisplayName("Relaxed rules pick the lighter HIGH volatility leg")
        void greedyPicksLighterLater() {
            LadderOutcome outcome = run(rules(1.90, 0, 0, true, 0), new FallbackLadder(0.0, 0.30), 2);

            StepAttempt stepTwo = outcome.getAttempts().get(RelaxationStep.EXTRA_HIGH_VOLATILITY.getIndex());
            assertThat(stepTwo.getOutcome()).isEqualTo(StepAttempt.Outcome.WEIGHT_TOO_LOW);
            assertThat(stepTwo.getAggregateWeight()).isLessThan(STRONG_PLUS_MODERATE);
        }
    }

    @Nested
    @DisplayName("Exhaustion")
    class Exhaustion {

        @Test
        @DisplayName("Unreachable floor runs all six rungs and accepts nothing")
        void unreachableFloor() {
            LadderOutcome outcome = run(rules(5.0, 0, 0, true, 0), new FallbackLadder(0.15, 0.30), 2);

            assertThat(outcome.isAccepted()).isFalse();
            assertThat(outcome.getAssembly()).isNull();
            assertThat(outcome.getRulesApplied()).isNull();
            assertThat(outcome.getAttempts())
                    .hasSize(6)
                    .allMatch(attempt -> attempt.getOutcome() == StepAttempt.Outcome.WEIGHT_TOO_LOW);
        }

        @Test
        @DisplayName("Pool that cannot fill the count is constraint-blocked at every rung")
        void cannotFill() {
            LadderOutcome outcome = run(rules(0.0, 0, 0, true, 0), new FallbackLadder(0.15, 0.30), 4);

            assertThat(outcome.isAccepted()).isFalse();
            assertThat(outcome.getAttempts())
                    .extracting(StepAttempt::getOutcome)
                    .containsOnly(StepAttempt.Outcome.CONSTRAINT_BLOCKED);
        }
    }

    @Test
    @DisplayName("A NaN aggregate weight never clears the floor")
    void nanWeightNeverAccepted() {
        List<RankedLeg> nanPool = List.of(
                ranked(leg("N1").build(), Tier.STRONG, Double.NaN),
                ranked(leg("N2").build(), Tier.STRONG, 1.2));

        LadderOutcome outcome = run(nanPool, rules(0.0, 0, 0, true, 0), new FallbackLadder(0.15, 0.30), 2);

        assertThat(outcome.isAccepted()).isFalse();
        assertThat(outcome.getAttempts())
                .hasSize(6)
                .allMatch(attempt -> attempt.getOutcome() == StepAttempt.Outcome.WEIGHT_TOO_LOW);
    }
}
