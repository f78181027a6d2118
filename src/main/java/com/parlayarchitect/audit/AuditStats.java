package com.parlayarchitect.audit;

import com.parlayarchitect.domain.enums.RejectionReason;
import java.util.Map;
import lombok.Value;

/**
 * Aggregate health of recent selections held by the in-memory audit sink.
 */
@Value
public class AuditStats {

    int total;
    int accepted;
    int rejected;
    Map<RejectionReason, Integer> rejectedByReason;

    /** Accepted share of all recorded attempts, 0 when nothing was recorded. */
    public double getSuccessRate() {
        return accepted / (double) Math.max(1, total);
    }
}
