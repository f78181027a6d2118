package com.parlayarchitect.selection;

import com.parlayarchitect.correlation.CorrelationGuard;
import com.parlayarchitect.domain.enums.Tier;
import com.parlayarchitect.domain.enums.VolatilityClass;
import com.parlayarchitect.domain.model.Leg;
import com.parlayarchitect.domain.model.RankedLeg;
import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.domain.model.TierShortfall;
import com.parlayarchitect.rules.RelaxationStep;
import com.parlayarchitect.scoring.WeightCalculator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Deterministic greedy assembly of one candidate selection under a single rule set.
 *
 * <p>The pool must already be sorted by {@link LegRanking}. Assembly runs in three passes over
 * that order:
 * <ol>
 *   <li>reserve up to {@code minStrong} STRONG legs</li>
 *   <li>reserve up to {@code minModerate} MODERATE legs</li>
 *   <li>fill the remaining slots with the best remaining legs</li>
 * </ol>
 * Every pass honours the correlation guard, the per-event limit, the WEAK allowance and the HIGH
 * volatility cap. Legs without an event id are not limited per event.
 * Tier minimums are soft: when the pool cannot fill a reservation the slots go to the fill pass
 * and the gap is reported as a {@link TierShortfall}.
 */
@Component
public class SelectionAssembler {

    private final CorrelationGuard correlationGuard;
    private final WeightCalculator weightCalculator;

    public SelectionAssembler(CorrelationGuard correlationGuard, WeightCalculator weightCalculator) {
        this.correlationGuard = correlationGuard;
        this.weightCalculator = weightCalculator;
    }

    public Assembly assemble(
            RelaxationStep step,
            List<RankedLeg> rankedPool,
            RuleSet rules,
            int legCount,
            boolean allowSameEntity,
            boolean allowSameEvent,
            Comparator<RankedLeg> ranking) {
        Draft draft = new Draft(rules, legCount, allowSameEntity, allowSameEvent);

        draft.reserve(rankedPool, Tier.STRONG, rules.getMinStrong());
        draft.reserve(rankedPool, Tier.MODERATE, rules.getMinModerate());
        for (RankedLeg leg : rankedPool) {
            if (draft.isFull()) {
                break;
            }
            draft.tryAdd(leg);
        }

        List<RankedLeg> legs = new ArrayList<>(draft.selected);
        legs.sort(ranking);
        return new Assembly(step, rules, List.copyOf(legs), weightCalculator.aggregateWeight(legs));
    }

    /**
     * Soft tier minimums of {@code rules} that {@code legs} does not meet.
     */
    public List<TierShortfall> shortfalls(List<RankedLeg> legs, RuleSet rules) {
        List<TierShortfall> shortfalls = new ArrayList<>();
        int strong = countTier(legs, Tier.STRONG);
        int moderate = countTier(legs, Tier.MODERATE);
        if (strong < rules.getMinStrong()) {
            shortfalls.add(new TierShortfall(Tier.STRONG, rules.getMinStrong(), strong));
        }
        if (moderate < rules.getMinModerate()) {
            shortfalls.add(new TierShortfall(Tier.MODERATE, rules.getMinModerate(), moderate));
        }
        return shortfalls;
    }

    private static int countTier(List<RankedLeg> legs, Tier tier) {
        return (int) legs.stream().filter(leg -> leg.getTier() == tier).count();
    }

    /** Mutable state of one assembly; never shared between calls. */
    private final class Draft {

        private final RuleSet rules;
        private final int legCount;
        private final boolean allowSameEntity;
        private final boolean allowSameEvent;

        private final List<RankedLeg> selected = new ArrayList<>();
        private final Set<String> selectedIds = new HashSet<>();
        private final Set<String> usedEntityKeys = new HashSet<>();
        private final Map<String, Integer> legsPerEvent = new HashMap<>();
        private int highVolatility;

        private Draft(RuleSet rules, int legCount, boolean allowSameEntity, boolean allowSameEvent) {
            this.rules = rules;
            this.legCount = legCount;
            this.allowSameEntity = allowSameEntity;
            this.allowSameEvent = allowSameEvent;
        }

        boolean isFull() {
            return selected.size() >= legCount;
        }

        void reserve(List<RankedLeg> rankedPool, Tier tier, int wanted) {
            int reserved = 0;
            for (RankedLeg leg : rankedPool) {
                if (reserved >= wanted || isFull()) {
                    return;
                }
                if (leg.getTier() == tier && tryAdd(leg)) {
                    reserved++;
                }
            }
        }

        boolean tryAdd(RankedLeg candidate) {
            Leg leg = candidate.getLeg();
            if (selectedIds.contains(candidate.getId())) {
                return false;
            }
            if (candidate.getTier() == Tier.WEAK && !rules.isAllowWeak()) {
                return false;
            }
            boolean high = leg.getVolatility() == VolatilityClass.HIGH;
            if (high && highVolatility >= rules.getMaxHighVolatility()) {
                return false;
            }
            if (correlationGuard.violates(usedEntityKeys, leg, allowSameEntity)) {
                return false;
            }
            if (!allowSameEvent
                    && leg.hasEventId()
                    && legsPerEvent.getOrDefault(leg.getEventId(), 0) >= rules.getMaxSameEvent()) {
                return false;
            }

            selected.add(candidate);
            selectedIds.add(candidate.getId());
            if (leg.hasEntityKey()) {
                usedEntityKeys.add(leg.getEntityKey());
            }
            if (leg.hasEventId()) {
                legsPerEvent.merge(leg.getEventId(), 1, Integer::sum);
            }
            if (high) {
                highVolatility++;
            }
            return true;
        }
    }
}
