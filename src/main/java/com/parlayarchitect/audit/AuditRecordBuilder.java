package com.parlayarchitect.audit;

import com.parlayarchitect.domain.model.RankedLeg;
import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.domain.model.SelectionRequest;
import com.parlayarchitect.domain.model.SelectionResult;
import com.parlayarchitect.selection.LadderOutcome;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Converts a terminal {@link SelectionResult} plus its context into an {@link AuditRecord}.
 *
 * <p>The fingerprint is {@code "sha256:" + hex(SHA-256(sorted leg ids joined by '\n'))}. The same
 * set of legs always yields the same fingerprint regardless of selection order, so the storage
 * collaborator can spot duplicate selections across requests. Rejected results fingerprint the
 * empty selection.
 */
@Component
public class AuditRecordBuilder {

    static final String FINGERPRINT_PREFIX = "sha256:";

    private final Clock clock;

    public AuditRecordBuilder(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param request the request as received (may be null for a null request)
     * @param includeOptionalCategory effective category inclusion used by the gate
     * @param rulesBase configured rule set of the profile, or null if unresolved
     * @param result terminal result
     * @param ladderOutcome ladder trace, or null when the ladder did not run
     */
    public AuditRecord build(
            SelectionRequest request,
            boolean includeOptionalCategory,
            RuleSet rulesBase,
            SelectionResult result,
            LadderOutcome ladderOutcome) {
        List<String> selectedIds = new ArrayList<>();
        double aggregateWeight = 0.0;
        String relaxationStep;
        if (result instanceof SelectionResult.Accepted accepted) {
            accepted.getLegs().stream().map(RankedLeg::getId).forEach(selectedIds::add);
            aggregateWeight = accepted.getAggregateWeight();
            relaxationStep = String.valueOf(accepted.getRelaxationStep());
        } else {
            relaxationStep = ladderOutcome != null ? AuditRecord.STEP_EXHAUSTED : AuditRecord.STEP_SKIPPED;
        }

        return AuditRecord.builder()
                .attemptId(UUID.randomUUID().toString())
                .createdAt(clock.instant())
                .requestedProfile(request != null ? request.getRiskProfile() : null)
                .legCount(request != null ? request.getLegCount() : 0)
                .allowSameEntity(request != null && request.isAllowSameEntity())
                .allowSameEvent(request != null && request.isAllowSameEvent())
                .includeOptionalCategory(includeOptionalCategory)
                .seed(request != null ? request.getSeed() : 0L)
                .inventory(result.getDiagnostic())
                .rulesBase(rulesBase)
                .status(result.getStatus())
                .reasonCode(result instanceof SelectionResult.Rejected rejected ? rejected.getReasonCode() : null)
                .relaxationStep(relaxationStep)
                .aggregateWeight(aggregateWeight)
                .selectedLegIds(List.copyOf(selectedIds))
                .fingerprint(fingerprint(selectedIds))
                .ladderTrace(ladderOutcome != null ? ladderOutcome.getAttempts() : List.of())
                .build();
    }

    public static String fingerprint(List<String> legIds) {
        List<String> sorted = new ArrayList<>(legIds);
        Collections.sort(sorted);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.join("\n", sorted).getBytes(StandardCharsets.UTF_8));
            return FINGERPRINT_PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
