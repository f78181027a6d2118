package com.parlayarchitect.rules;

import com.parlayarchitect.domain.enums.MarketCategory;
import com.parlayarchitect.exception.ConfigurationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-category confidence cutoffs for promoting a MEDIUM signal to the MODERATE tier.
 *
 * <p>Noisier categories (proposition markets) carry higher cutoffs. Every category must have a
 * threshold in (0,1]; {@link #of(Map)} enforces this at load time.
 */
public final class TierThresholds {

    private final Map<MarketCategory, Double> thresholds;

    private TierThresholds(Map<MarketCategory, Double> thresholds) {
        this.thresholds = Collections.unmodifiableMap(thresholds);
    }

    /**
     * Validates and freezes a threshold table.
     *
     * @throws ConfigurationException if a category is missing or a value lies outside (0,1]
     */
    public static TierThresholds of(Map<MarketCategory, Double> source) {
        if (source == null) {
            throw new ConfigurationException("Category tier thresholds are not configured");
        }
        Map<MarketCategory, Double> copy = new EnumMap<>(MarketCategory.class);
        for (MarketCategory category : MarketCategory.values()) {
            Double value = source.get(category);
            if (value == null) {
                throw new ConfigurationException(
                        "Missing tier threshold for category " + category,
                        Map.of("category", category.name(), "configured", List.copyOf(source.keySet())));
            }
            if (value.isNaN() || value <= 0.0 || value > 1.0) {
                throw new ConfigurationException(
                        "Tier threshold for " + category + " must be in (0,1], was " + value,
                        Map.of("category", category.name(), "value", value));
            }
            copy.put(category, value);
        }
        return new TierThresholds(copy);
    }

    public double thresholdFor(MarketCategory category) {
        return thresholds.get(category);
    }

    public Map<MarketCategory, Double> asMap() {
        return thresholds;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TierThresholds other && thresholds.equals(other.thresholds);
    }

    @Override
    public int hashCode() {
        return thresholds.hashCode();
    }

    @Override
    public String toString() {
        return "TierThresholds" + thresholds;
    }
}
