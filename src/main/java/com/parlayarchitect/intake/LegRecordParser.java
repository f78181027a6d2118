package com.parlayarchitect.intake;

import com.parlayarchitect.domain.enums.MarketCategory;
import com.parlayarchitect.domain.enums.QualitySignal;
import com.parlayarchitect.domain.enums.VolatilityClass;
import com.parlayarchitect.domain.model.Leg;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validation boundary between the loosely typed upstream feed and the engine.
 *
 * <p>Each upstream record is a JSON-like map with snake_case keys:
 * <pre>
 *   id, entity_key, event_id, selection, quality_signal, confidence, volatility,
 *   market_category, gate_a_pass, gate_b_pass, ev, clv, total_deviation, injury_stable, is_locked
 * </pre>
 * Records that cannot be turned into a {@link Leg} are quarantined with a reason instead of
 * being passed on; the engine only ever sees fully formed legs. Duplicate ids are quarantined
 * too (first occurrence wins) because ids are the final tie-break and must be unique.
 *
 * <p>Confidence may arrive on a 0-100 scale; values above 1 (up to 100) are divided by 100.
 */
@Component
public class LegRecordParser {

    private static final Logger log = LoggerFactory.getLogger(LegRecordParser.class);

    public IntakeResult parse(List<Map<String, Object>> records) {
        List<Leg> legs = new ArrayList<>();
        List<MalformedRecord> malformed = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        if (records == null) {
            return new IntakeResult(legs, malformed);
        }

        for (int i = 0; i < records.size(); i++) {
            Map<String, Object> record = records.get(i);
            String recordId = record == null ? null : asText(record.get("id"));
            try {
                Leg leg = toLeg(record);
                if (!seenIds.add(leg.getId())) {
                    throw new MalformedLegException("duplicate id");
                }
                legs.add(leg);
            } catch (MalformedLegException e) {
                malformed.add(new MalformedRecord(i, recordId, e.getMessage()));
            }
        }

        if (!malformed.isEmpty()) {
            log.warn("Quarantined {} of {} upstream leg records: {}", malformed.size(), records.size(),
                    malformed.size() > 5 ? malformed.subList(0, 5) + " ..." : malformed);
        }
        return new IntakeResult(legs, malformed);
    }

    /**
     * Applies the same boundary checks to legs that were built in-process: null entries, missing
     * ids or enums, confidence outside [0,1], non-finite scoring inputs and duplicate ids are
     * quarantined.
     */
    public IntakeResult screen(List<Leg> candidates) {
        List<Leg> legs = new ArrayList<>();
        List<MalformedRecord> malformed = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        if (candidates == null) {
            return new IntakeResult(legs, malformed);
        }

        for (int i = 0; i < candidates.size(); i++) {
            Leg leg = candidates.get(i);
            String problem = problemWith(leg);
            if (problem == null && !seenIds.add(leg.getId())) {
                problem = "duplicate id";
            }
            if (problem == null) {
                legs.add(leg);
            } else {
                malformed.add(new MalformedRecord(i, leg == null ? null : leg.getId(), problem));
            }
        }

        if (!malformed.isEmpty()) {
            log.warn("Quarantined {} of {} candidate legs: {}", malformed.size(), candidates.size(), malformed);
        }
        return new IntakeResult(legs, malformed);
    }

    private static String problemWith(Leg leg) {
        if (leg == null) {
            return "null leg";
        }
        if (leg.getId() == null || leg.getId().isBlank()) {
            return "missing id";
        }
        if (leg.getQualitySignal() == null || leg.getVolatility() == null || leg.getMarketCategory() == null) {
            return "missing quality signal, volatility or market category";
        }
        if (Double.isNaN(leg.getConfidence()) || leg.getConfidence() < 0.0 || leg.getConfidence() > 1.0) {
            return "confidence out of range: " + leg.getConfidence();
        }
        if (!Double.isFinite(leg.getExpectedValue())) {
            return "ev is not finite: " + leg.getExpectedValue();
        }
        if (!Double.isFinite(leg.getClosingLineValue())) {
            return "clv is not finite: " + leg.getClosingLineValue();
        }
        if (!Double.isFinite(leg.getTotalDeviation())) {
            return "total_deviation is not finite: " + leg.getTotalDeviation();
        }
        return null;
    }

    private Leg toLeg(Map<String, Object> record) {
        if (record == null) {
            throw new MalformedLegException("null record");
        }
        String id = asText(record.get("id"));
        if (id == null) {
            throw new MalformedLegException("missing id");
        }

        return Leg.builder()
                .id(id)
                .entityKey(asText(record.get("entity_key")))
                .eventId(asText(record.get("event_id")))
                .selection(asText(record.get("selection")))
                .qualitySignal(QualitySignal.fromLabel(asText(record.get("quality_signal"))))
                .confidence(parseConfidence(record.get("confidence")))
                .volatility(parseVolatility(record.get("volatility")))
                .marketCategory(parseCategory(record.get("market_category")))
                .gateAPassed(requireFlag(record, "gate_a_pass"))
                .gateBPassed(requireFlag(record, "gate_b_pass"))
                .expectedValue(optionalNumber(record, "ev", 0.0))
                .closingLineValue(optionalNumber(record, "clv", 0.0))
                .totalDeviation(optionalNumber(record, "total_deviation", 0.0))
                .injuryStable(optionalFlag(record, "injury_stable", true))
                .locked(optionalFlag(record, "is_locked", false))
                .build();
    }

    // ========================
    // FIELD PARSING
    // ========================

    private double parseConfidence(Object raw) {
        if (raw == null) {
            throw new MalformedLegException("missing confidence");
        }
        double value = asNumber(raw, "confidence");
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new MalformedLegException("confidence out of range: " + raw);
        }
        return value > 1.0 ? value / 100.0 : value;
    }

    private VolatilityClass parseVolatility(Object raw) {
        String label = asText(raw);
        if (label == null) {
            throw new MalformedLegException("missing volatility");
        }
        String normalized = label.toUpperCase(Locale.ROOT);
        if ("MODERATE".equals(normalized)) {
            return VolatilityClass.MEDIUM;
        }
        try {
            return VolatilityClass.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new MalformedLegException("unknown volatility: " + label);
        }
    }

    private MarketCategory parseCategory(Object raw) {
        String label = asText(raw);
        if (label == null) {
            throw new MalformedLegException("missing market_category");
        }
        try {
            return MarketCategory.valueOf(label.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedLegException("unknown market_category: " + label);
        }
    }

    private boolean requireFlag(Map<String, Object> record, String key) {
        Object raw = record.get(key);
        if (raw instanceof Boolean flag) {
            return flag;
        }
        throw new MalformedLegException(raw == null ? "missing " + key : key + " is not a boolean: " + raw);
    }

    private boolean optionalFlag(Map<String, Object> record, String key, boolean fallback) {
        Object raw = record.get(key);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Boolean flag) {
            return flag;
        }
        throw new MalformedLegException(key + " is not a boolean: " + raw);
    }

    private double optionalNumber(Map<String, Object> record, String key, double fallback) {
        Object raw = record.get(key);
        if (raw == null) {
            return fallback;
        }
        double value = asNumber(raw, key);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new MalformedLegException(key + " is not finite: " + raw);
        }
        return value;
    }

    private double asNumber(Object raw, String key) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new MalformedLegException(key + " is not numeric: " + text);
            }
        }
        throw new MalformedLegException(key + " is not numeric: " + raw);
    }

    private static String asText(Object raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /** Internal signal for a record that cannot become a leg. Never leaves this class. */
    private static final class MalformedLegException extends RuntimeException {

        MalformedLegException(String message) {
            super(message, null, false, false);
        }
    }
}
