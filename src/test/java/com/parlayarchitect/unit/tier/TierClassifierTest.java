package com.parlayarchitect.unit.tier;

import static com.parlayarchitect.unit.fixtures.LegFixtures.leg;
import static org.assertj.core.api.Assertions.assertThat;

import com.parlayarchitect.domain.enums.MarketCategory;
import com.parlayarchitect.domain.enums.QualitySignal;
import com.parlayarchitect.domain.enums.Tier;
import com.parlayarchitect.rules.TierThresholds;
import com.parlayarchitect.tier.TierClassifier;
import com.parlayarchitect.unit.fixtures.ArchitectFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TierClassifierTest {

    private final TierClassifier tierClassifier = new TierClassifier();
    private final TierThresholds thresholds = ArchitectFixtures.defaultConfiguration().getTierThresholds();

    @Test
    @DisplayName("STRONG signal is STRONG regardless of confidence")
    void strongSignal() {
        assertThat(tierClassifier.classify(leg("L1").confidence(0.10).build(), thresholds))
                .isEqualTo(Tier.STRONG);
    }

    @ParameterizedTest(name = "MEDIUM {0} at {1} -> {2}")
    @CsvSource({
        "SPREAD, 0.60, MODERATE",
        "SPREAD, 0.59, WEAK",
        "MONEYLINE, 0.58, MODERATE",
        "MONEYLINE, 0.57, WEAK",
        "PROP, 0.64, WEAK",
        "PROP, 0.65, MODERATE"
    })
    @DisplayName("MEDIUM signal is promoted at the category threshold")
    void mediumSignal(MarketCategory category, double confidence, Tier expected) {
        var medium = leg("L1")
                .qualitySignal(QualitySignal.MEDIUM)
                .marketCategory(category)
                .confidence(confidence)
                .build();

        assertThat(tierClassifier.classify(medium, thresholds)).isEqualTo(expected);
    }

    @Test
    @DisplayName("WEAK and UNDECIDED signals are WEAK even at full confidence")
    void weakAndUndecided() {
        assertThat(tierClassifier.classify(
                        leg("L1").qualitySignal(QualitySignal.WEAK).confidence(1.0).build(), thresholds))
                .isEqualTo(Tier.WEAK);
        assertThat(tierClassifier.classify(
                        leg("L2").qualitySignal(QualitySignal.UNDECIDED).confidence(1.0).build(), thresholds))
                .isEqualTo(Tier.WEAK);
    }
}
