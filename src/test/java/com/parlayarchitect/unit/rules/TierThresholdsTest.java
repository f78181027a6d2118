package com.parlayarchitect.unit.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.parlayarchitect.domain.enums.MarketCategory;
import com.parlayarchitect.exception.ConfigurationException;
import com.parlayarchitect.exception.ErrorCode;
import com.parlayarchitect.rules.TierThresholds;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TierThresholdsTest {

    private static Map<MarketCategory, Double> complete() {
        Map<MarketCategory, Double> values = new EnumMap<>(MarketCategory.class);
        for (MarketCategory category : MarketCategory.values()) {
            values.put(category, 0.60);
        }
        return values;
    }

    @Test
    @DisplayName("Complete table in range is accepted")
    void valid() {
        Map<MarketCategory, Double> values = complete();
        values.put(MarketCategory.PROP, 1.0);

        TierThresholds thresholds = TierThresholds.of(values);

        assertThat(thresholds.thresholdFor(MarketCategory.PROP)).isEqualTo(1.0);
        assertThat(thresholds.asMap()).hasSize(MarketCategory.values().length);
    }

    @Test
    @DisplayName("Missing category fails with CONFIGURATION_ERROR")
    void missingCategory() {
        Map<MarketCategory, Double> values = complete();
        values.remove(MarketCategory.MONEYLINE);

        assertThatThrownBy(() -> TierThresholds.of(values))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("MONEYLINE")
                .extracting("errorCode")
                .isEqualTo(ErrorCode.CONFIGURATION_ERROR);
    }

    @Test
    @DisplayName("Zero and values above one are out of range")
    void outOfRange() {
        Map<MarketCategory, Double> zero = complete();
        zero.put(MarketCategory.SPREAD, 0.0);
        Map<MarketCategory, Double> tooHigh = complete();
        tooHigh.put(MarketCategory.TOTAL, 1.01);

        assertThatThrownBy(() -> TierThresholds.of(zero)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> TierThresholds.of(tooHigh)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Later changes to the source map do not leak in")
    void copiesSourceMap() {
        Map<MarketCategory, Double> values = complete();
        TierThresholds thresholds = TierThresholds.of(values);

        values.put(MarketCategory.SPREAD, 0.99);

        assertThat(thresholds.thresholdFor(MarketCategory.SPREAD)).isEqualTo(0.60);
    }
}
