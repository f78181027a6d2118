package com.parlayarchitect.eligibility;

import com.parlayarchitect.domain.enums.BlockReason;
import com.parlayarchitect.domain.model.Leg;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hard eligibility filter applied before any selection attempt.
 *
 * <p>Checks (in order, first match wins):
 * <ol>
 *   <li>Gate A and Gate B both failed -- counted as BOTH</li>
 *   <li>Gate A failed -- GATE_A</li>
 *   <li>Gate B failed -- GATE_B</li>
 *   <li>Optional market category not included -- CATEGORY_EXCLUDED</li>
 * </ol>
 *
 * <p>The gate is never relaxed by the fallback ladder. It represents data-integrity guarantees,
 * not preferences.
 */
@Component
public class EligibilityGate {

    private static final Logger log = LoggerFactory.getLogger(EligibilityGate.class);

    /**
     * Splits the candidates into eligible and blocked legs, preserving input order.
     *
     * @param legs candidates from the intake boundary
     * @param includeOptionalCategory whether optional-category (proposition) legs may enter the pool
     */
    public EligibilityResult partition(List<Leg> legs, boolean includeOptionalCategory) {
        List<Leg> eligible = new ArrayList<>();
        List<Leg> blocked = new ArrayList<>();
        Map<BlockReason, Integer> counts = new EnumMap<>(BlockReason.class);
        counts.put(BlockReason.GATE_A, 0);
        counts.put(BlockReason.GATE_B, 0);
        counts.put(BlockReason.BOTH, 0);
        counts.put(BlockReason.CATEGORY_EXCLUDED, 0);

        for (Leg leg : legs) {
            BlockReason reason = blockReason(leg, includeOptionalCategory);
            if (reason == null) {
                eligible.add(leg);
            } else {
                blocked.add(leg);
                counts.merge(reason, 1, Integer::sum);
            }
        }

        log.debug("Eligibility gate: {} eligible, {} blocked {}", eligible.size(), blocked.size(), counts);
        return new EligibilityResult(
                Collections.unmodifiableList(eligible),
                Collections.unmodifiableList(blocked),
                Collections.unmodifiableMap(counts));
    }

    /**
     * Returns the reason a leg is blocked, or null when it is eligible.
     */
    public BlockReason blockReason(Leg leg, boolean includeOptionalCategory) {
        if (!leg.isGateAPassed() && !leg.isGateBPassed()) {
            return BlockReason.BOTH;
        }
        if (!leg.isGateAPassed()) {
            return BlockReason.GATE_A;
        }
        if (!leg.isGateBPassed()) {
            return BlockReason.GATE_B;
        }
        if (leg.getMarketCategory().isOptional() && !includeOptionalCategory) {
            return BlockReason.CATEGORY_EXCLUDED;
        }
        return null;
    }
}
