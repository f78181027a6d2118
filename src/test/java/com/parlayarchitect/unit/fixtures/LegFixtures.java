package com.parlayarchitect.unit.fixtures;

import com.parlayarchitect.domain.enums.MarketCategory;
import com.parlayarchitect.domain.enums.QualitySignal;
import com.parlayarchitect.domain.enums.Tier;
import com.parlayarchitect.domain.enums.VolatilityClass;
import com.parlayarchitect.domain.model.Leg;
import com.parlayarchitect.domain.model.RankedLeg;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared leg builders for unit and integration tests.
 *
 * <p>The default leg passes both gates, is a LOW volatility SPREAD leg with a STRONG signal and
 * confidence 0.70, and has its own entity key.
 */
public final class LegFixtures {

    private LegFixtures() {}

    public static Leg.LegBuilder leg(String id) {
        return Leg.builder()
                .id(id)
                .entityKey("entity-" + id)
                .eventId("event-" + id)
                .selection("Selection " + id)
                .qualitySignal(QualitySignal.STRONG)
                .confidence(0.70)
                .volatility(VolatilityClass.LOW)
                .marketCategory(MarketCategory.SPREAD)
                .gateAPassed(true)
                .gateBPassed(true);
    }

    public static Leg strong(String id) {
        return leg(id).build();
    }

    public static Leg medium(String id, double confidence) {
        return leg(id).qualitySignal(QualitySignal.MEDIUM).confidence(confidence).build();
    }

    public static Leg weak(String id) {
        return leg(id).qualitySignal(QualitySignal.WEAK).build();
    }

    /** {@code count} STRONG legs with ids prefix-00, prefix-01, ... and distinct entities. */
    public static List<Leg> strongPool(String prefix, int count) {
        List<Leg> legs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            legs.add(strong(String.format("%s-%02d", prefix, i)));
        }
        return legs;
    }

    public static RankedLeg ranked(Leg leg, Tier tier, double weight) {
        return new RankedLeg(leg, tier, weight);
    }

    /** Upstream record map with every required field, mirroring {@link #leg(String)}. */
    public static Map<String, Object> record(String id) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", id);
        record.put("entity_key", "entity-" + id);
        record.put("event_id", "event-" + id);
        record.put("selection", "Selection " + id);
        record.put("quality_signal", "STRONG");
        record.put("confidence", 0.70);
        record.put("volatility", "LOW");
        record.put("market_category", "SPREAD");
        record.put("gate_a_pass", true);
        record.put("gate_b_pass", true);
        return record;
    }
}
