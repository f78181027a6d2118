package com.parlayarchitect.unit.audit;

import static org.assertj.core.api.Assertions.assertThat;

import com.parlayarchitect.audit.AuditRecord;
import com.parlayarchitect.audit.AuditStats;
import com.parlayarchitect.audit.InMemoryAuditSink;
import com.parlayarchitect.domain.enums.RejectionReason;
import com.parlayarchitect.domain.enums.SelectionStatus;
import com.parlayarchitect.unit.fixtures.ArchitectFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for InMemoryAuditSink: ring buffer order and eviction, and the summary stats.
 */
class InMemoryAuditSinkTest {

    private InMemoryAuditSink sink;

    @BeforeEach
    void setUp() {
        sink = new InMemoryAuditSink();
    }

    private static AuditRecord auditRecord(String attemptId, SelectionStatus status, RejectionReason reason) {
        return AuditRecord.builder()
                .attemptId(attemptId)
                .createdAt(ArchitectFixtures.FIXED_INSTANT)
                .requestedProfile("balanced")
                .legCount(3)
                .status(status)
                .reasonCode(reason)
                .relaxationStep(status == SelectionStatus.ACCEPTED ? "0" : AuditRecord.STEP_EXHAUSTED)
                .selectedLegIds(List.of())
                .fingerprint("sha256:test")
                .ladderTrace(List.of())
                .build();
    }

    @Test
    @DisplayName("Recent records come back newest first")
    void newestFirst() {
        sink.write(auditRecord("a1", SelectionStatus.ACCEPTED, null));
        sink.write(auditRecord("a2", SelectionStatus.ACCEPTED, null));
        sink.write(auditRecord("a3", SelectionStatus.ACCEPTED, null));

        assertThat(sink.recent(2)).extracting(AuditRecord::getAttemptId).containsExactly("a3", "a2");
    }

    @Test
    @DisplayName("Buffer keeps at most 1000 records, evicting the oldest")
    void eviction() {
        for (int i = 0; i < 1005; i++) {
            sink.write(auditRecord("a" + i, SelectionStatus.ACCEPTED, null));
        }

        assertThat(sink.size()).isEqualTo(1000);
        List<AuditRecord> all = sink.recent(2000);
        assertThat(all).hasSize(1000);
        assertThat(all.get(0).getAttemptId()).isEqualTo("a1004");
        assertThat(all.get(999).getAttemptId()).isEqualTo("a5");
    }

    @Test
    @DisplayName("Stats report success rate and failures by reason")
    void stats() {
        sink.write(auditRecord("a1", SelectionStatus.ACCEPTED, null));
        sink.write(auditRecord("a2", SelectionStatus.REJECTED, RejectionReason.NO_VALID_SELECTION));
        sink.write(auditRecord("a3", SelectionStatus.REJECTED, RejectionReason.NO_VALID_SELECTION));
        sink.write(auditRecord("a4", SelectionStatus.REJECTED, RejectionReason.INSUFFICIENT_POOL));

        AuditStats stats = sink.stats();

        assertThat(stats.getTotal()).isEqualTo(4);
        assertThat(stats.getAccepted()).isEqualTo(1);
        assertThat(stats.getRejected()).isEqualTo(3);
        assertThat(stats.getSuccessRate()).isEqualTo(0.25);
        assertThat(stats.getRejectedByReason())
                .containsEntry(RejectionReason.NO_VALID_SELECTION, 2)
                .containsEntry(RejectionReason.INSUFFICIENT_POOL, 1)
                .doesNotContainKey(RejectionReason.INVALID_REQUEST);
    }

    @Test
    @DisplayName("Empty sink has zero success rate")
    void emptyStats() {
        assertThat(sink.stats().getSuccessRate()).isZero();
        assertThat(sink.recent(10)).isEmpty();
    }
}
