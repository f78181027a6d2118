package com.parlayarchitect.domain.model;

import com.parlayarchitect.domain.enums.BlockReason;
import com.parlayarchitect.domain.enums.MarketCategory;
import com.parlayarchitect.domain.enums.Tier;
import java.util.EnumMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Diagnostic inventory of the candidate pool, captured before the fallback ladder runs.
 *
 * <p>The snapshot separates "upstream data problem" (high blocked counts) from "rules too
 * strict" (high eligible counts that still end in rejection). Invariant:
 * {@code eligibleTotal == sum(eligibleByTier)}.
 */
@Value
@Builder
public class InventorySnapshot {

    /** All records offered by upstream, including malformed ones. */
    int totalCandidates;

    int eligibleTotal;

    Map<Tier, Integer> eligibleByTier;

    Map<BlockReason, Integer> blockedCounts;

    Map<MarketCategory, Integer> eligibleByCategory;

    /** Eligible legs without an entity key; these bypass the correlation guard. */
    int correlationUncheckedCount;

    public int eligibleCount(Tier tier) {
        return eligibleByTier.getOrDefault(tier, 0);
    }

    public int blockedCount(BlockReason reason) {
        return blockedCounts.getOrDefault(reason, 0);
    }

    public int getBlockedTotal() {
        return blockedCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public static <E extends Enum<E>> Map<E, Integer> zeroCounts(Class<E> type) {
        Map<E, Integer> counts = new EnumMap<>(type);
        for (E constant : type.getEnumConstants()) {
            counts.put(constant, 0);
        }
        return counts;
    }
}
