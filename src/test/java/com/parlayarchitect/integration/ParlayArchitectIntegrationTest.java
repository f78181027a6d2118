package com.parlayarchitect.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.parlayarchitect.audit.AuditRecord;
import com.parlayarchitect.audit.InMemoryAuditSink;
import com.parlayarchitect.domain.enums.BlockReason;
import com.parlayarchitect.domain.enums.MarketCategory;
import com.parlayarchitect.domain.enums.RejectionReason;
import com.parlayarchitect.domain.enums.RiskProfile;
import com.parlayarchitect.domain.model.SelectionRequest;
import com.parlayarchitect.domain.model.SelectionResult;
import com.parlayarchitect.rules.ArchitectConfiguration;
import com.parlayarchitect.rules.ConfigurationHolder;
import com.parlayarchitect.selection.ParlayArchitectService;
import com.parlayarchitect.unit.fixtures.LegFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Boots the full application context from application.yml and runs selections end to end:
 * configuration binding, intake, ladder, audit sink and metrics listener wired together.
 */
@SpringBootTest
class ParlayArchitectIntegrationTest {

    @Autowired
    private ParlayArchitectService parlayArchitectService;

    @Autowired
    private ConfigurationHolder configurationHolder;

    @Autowired
    private InMemoryAuditSink inMemoryAuditSink;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("application.yml binds the default profiles, thresholds and ladder")
    void configurationBound() {
        ArchitectConfiguration configuration = configurationHolder.current();

        assertThat(configuration.getMaxLegs()).isEqualTo(12);
        assertThat(configuration.ruleSetFor(RiskProfile.PREMIUM).orElseThrow().getMinAggregateWeight())
                .isEqualTo(3.10);
        assertThat(configuration.ruleSetFor(RiskProfile.BALANCED).orElseThrow().getMaxHighVolatility())
                .isEqualTo(2);
        assertThat(configuration.ruleSetFor(RiskProfile.SPECULATIVE).orElseThrow().getMinStrong()).isZero();
        assertThat(configuration.ruleSetFor(RiskProfile.SPECULATIVE).orElseThrow().getMaxSameEvent()).isEqualTo(1);
        assertThat(configuration.getTierThresholds().thresholdFor(MarketCategory.PROP)).isEqualTo(0.65);
        assertThat(configuration.getFallbackLadder().getFirstWeightDelta()).isEqualTo(0.15);
    }

    @Test
    @DisplayName("Raw records flow through to an accepted parlay, an audit record and a metric")
    void recordsToAcceptedParlay() {
        List<Map<String, Object>> records = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            records.add(LegFixtures.record("IT-" + i));
        }
        Map<String, Object> broken = LegFixtures.record("IT-BROKEN");
        broken.put("volatility", "EXTREME");
        records.add(broken);
        double acceptedBefore = meterRegistry.find("parlay.selection.accepted").counter().count();

        SelectionResult result = parlayArchitectService.buildParlayFromRecords(
                SelectionRequest.builder().riskProfile("balanced").legCount(4).seed(5L).build(), records);

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getDiagnostic().blockedCount(BlockReason.MALFORMED)).isEqualTo(1);
        assertThat(meterRegistry.find("parlay.selection.accepted").counter().count()).isEqualTo(acceptedBefore + 1);

        AuditRecord latest = inMemoryAuditSink.recent(1).get(0);
        assertThat(latest.getSelectedLegCount()).isEqualTo(4);
        assertThat(latest.getRelaxationStep()).isEqualTo("0");
    }

    @Test
    @DisplayName("Rejection is audited and counted under its reason")
    void rejectionCounted() {
        double rejectedBefore = meterRegistry.find("parlay.selection.rejected")
                .tag("reason", RejectionReason.INSUFFICIENT_POOL.name())
                .counter()
                .count();

        SelectionResult result = parlayArchitectService.buildParlay(
                SelectionRequest.builder().riskProfile("premium").legCount(5).build(),
                LegFixtures.strongPool("IT", 3));

        assertThat(result.isRejected()).isTrue();
        assertThat(inMemoryAuditSink.recent(1).get(0).getReasonCode()).isEqualTo(RejectionReason.INSUFFICIENT_POOL);
        assertThat(meterRegistry.find("parlay.selection.rejected")
                        .tag("reason", RejectionReason.INSUFFICIENT_POOL.name())
                        .counter()
                        .count())
                .isEqualTo(rejectedBefore + 1);
    }
}
