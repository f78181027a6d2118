package com.parlayarchitect.eligibility;

import com.parlayarchitect.domain.enums.BlockReason;
import com.parlayarchitect.domain.model.Leg;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Partition of the candidate legs produced by the {@link EligibilityGate}.
 *
 * <p>{@code blockedCounts} always contains every gate-related {@link BlockReason}, zero when
 * nothing was blocked for that cause.
 */
@Value
public class EligibilityResult {

    List<Leg> eligible;
    List<Leg> blocked;
    Map<BlockReason, Integer> blockedCounts;

    public int getEligibleCount() {
        return eligible.size();
    }

    public int getBlockedCount() {
        return blocked.size();
    }
}
