package com.parlayarchitect.audit;

import com.parlayarchitect.domain.enums.RejectionReason;
import com.parlayarchitect.domain.enums.SelectionStatus;
import com.parlayarchitect.domain.model.InventorySnapshot;
import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.selection.StepAttempt;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Write-once audit record describing one selection invocation, success or failure.
 *
 * <p>Built by {@link AuditRecordBuilder} after the pure computation finishes and handed to the
 * {@link AuditSink}. The engine never reads records back.
 *
 * <p>Key fields:
 * <ul>
 *   <li>{@code requestedProfile} .. {@code seed} -- the request as received</li>
 *   <li>{@code inventory} -- pre-ladder snapshot (eligible by tier, blocked by cause)</li>
 *   <li>{@code relaxationStep} -- "0".."5", "EXHAUSTED" when the ladder ran out, "SKIPPED" when it
 *       never ran</li>
 *   <li>{@code fingerprint} -- sha256 of the sorted selected leg ids, for duplicate analytics</li>
 * </ul>
 */
@Value
@Builder
public class AuditRecord {

    public static final String STEP_EXHAUSTED = "EXHAUSTED";
    public static final String STEP_SKIPPED = "SKIPPED";

    String attemptId;

    Instant createdAt;

    String requestedProfile;

    int legCount;

    boolean allowSameEntity;

    boolean allowSameEvent;

    /** Effective category inclusion after applying the profile default. */
    boolean includeOptionalCategory;

    long seed;

    InventorySnapshot inventory;

    /** Rule set as configured for the profile; null when the profile could not be resolved. */
    RuleSet rulesBase;

    SelectionStatus status;

    /** Null for accepted selections. */
    RejectionReason reasonCode;

    String relaxationStep;

    double aggregateWeight;

    List<String> selectedLegIds;

    String fingerprint;

    List<StepAttempt> ladderTrace;

    public int getSelectedLegCount() {
        return selectedLegIds.size();
    }
}
