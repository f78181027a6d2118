package com.parlayarchitect.scoring;

import com.parlayarchitect.domain.enums.Tier;
import com.parlayarchitect.domain.model.Leg;
import com.parlayarchitect.domain.model.RankedLeg;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Per-leg and aggregate selection weights. Higher is better.
 *
 * <p>Leg weight:
 * <pre>
 *   tierBase + 0.65 * confidence
 *     + clamp(clv / 100, -0.02, 0.02) + 0.35 * min(0.25, |totalDeviation| / 20)
 *     + min(0.10, max(0, ev))
 *     - volatilityPenalty - injuryPenalty - lockedPenalty
 * </pre>
 * floored at zero. The tier is the dominant term (STRONG 1.00, MODERATE 0.70, WEAK 0.45). EV is
 * only ever a bonus; a missing EV does not hurt a leg.
 *
 * <p>Aggregate weight is the sum of {@code ln(1 + legWeight)} over the legs sorted by id, so the
 * floating-point result is identical for the same set of legs regardless of selection order.
 */
@Component
public class WeightCalculator {

    static final double CONFIDENCE_FACTOR = 0.65;
    static final double CLV_CAP = 0.02;
    static final double DEVIATION_FACTOR = 0.35;
    static final double DEVIATION_CAP = 0.25;
    static final double DEVIATION_SCALE = 20.0;
    static final double EV_CAP = 0.10;
    static final double INJURY_PENALTY = 0.08;
    static final double LOCKED_PENALTY = 0.15;
    static final double MIN_LEG_WEIGHT = 1e-6;

    public double legWeight(Leg leg, Tier tier) {
        double clvBoost = Math.max(-CLV_CAP, Math.min(CLV_CAP, leg.getClosingLineValue() / 100.0));
        double deviationBoost = Math.min(DEVIATION_CAP, Math.abs(leg.getTotalDeviation()) / DEVIATION_SCALE);
        double evBoost = Math.min(EV_CAP, Math.max(0.0, leg.getExpectedValue()));
        double injuryPenalty = leg.isInjuryStable() ? 0.0 : INJURY_PENALTY;
        double lockedPenalty = leg.isLocked() ? LOCKED_PENALTY : 0.0;

        double weight = tier.getBaseWeight()
                + CONFIDENCE_FACTOR * leg.getConfidence()
                + clvBoost
                + DEVIATION_FACTOR * deviationBoost
                + evBoost
                - leg.getVolatility().getWeightPenalty()
                - injuryPenalty
                - lockedPenalty;
        return Math.max(0.0, weight);
    }

    public double aggregateWeight(List<RankedLeg> legs) {
        List<RankedLeg> ordered = new ArrayList<>(legs);
        ordered.sort(Comparator.comparing(RankedLeg::getId));
        double total = 0.0;
        for (RankedLeg rankedLeg : ordered) {
            total += Math.log(Math.max(MIN_LEG_WEIGHT, rankedLeg.getWeight()) + 1.0);
        }
        return total;
    }
}
