package com.parlayarchitect.tier;

import com.parlayarchitect.domain.enums.Tier;
import com.parlayarchitect.domain.model.Leg;
import com.parlayarchitect.rules.TierThresholds;
import org.springframework.stereotype.Component;

/**
 * Maps a leg's upstream quality signal to a {@link Tier}.
 *
 * <p>Rules:
 * <ul>
 *   <li>STRONG signal -- always STRONG</li>
 *   <li>MEDIUM signal -- MODERATE when confidence reaches the category threshold, WEAK otherwise</li>
 *   <li>WEAK or UNDECIDED signal -- WEAK</li>
 * </ul>
 *
 * <p>The classification is a pure function of the leg and the thresholds.
 */
@Component
public class TierClassifier {

    public Tier classify(Leg leg, TierThresholds thresholds) {
        if (leg.getQualitySignal() == null) {
            return Tier.WEAK;
        }
        return switch (leg.getQualitySignal()) {
            case STRONG -> Tier.STRONG;
            case MEDIUM -> leg.getConfidence() >= thresholds.thresholdFor(leg.getMarketCategory())
                    ? Tier.MODERATE
                    : Tier.WEAK;
            case WEAK, UNDECIDED -> Tier.WEAK;
        };
    }
}
