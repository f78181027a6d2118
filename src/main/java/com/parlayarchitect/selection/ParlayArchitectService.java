package com.parlayarchitect.selection;

import com.parlayarchitect.audit.AuditRecord;
import com.parlayarchitect.audit.AuditRecordBuilder;
import com.parlayarchitect.audit.AuditSink;
import com.parlayarchitect.correlation.CorrelationGuard;
import com.parlayarchitect.domain.enums.BlockReason;
import com.parlayarchitect.domain.enums.MarketCategory;
import com.parlayarchitect.domain.enums.RejectionReason;
import com.parlayarchitect.domain.enums.RiskProfile;
import com.parlayarchitect.domain.enums.Tier;
import com.parlayarchitect.domain.model.InventorySnapshot;
import com.parlayarchitect.domain.model.Leg;
import com.parlayarchitect.domain.model.RankedLeg;
import com.parlayarchitect.domain.model.RuleSet;
import com.parlayarchitect.domain.model.SelectionRequest;
import com.parlayarchitect.domain.model.SelectionResult;
import com.parlayarchitect.eligibility.EligibilityGate;
import com.parlayarchitect.eligibility.EligibilityResult;
import com.parlayarchitect.event.SelectionCompletedEvent;
import com.parlayarchitect.exception.InvalidRequestException;
import com.parlayarchitect.intake.IntakeResult;
import com.parlayarchitect.intake.LegRecordParser;
import com.parlayarchitect.rules.ArchitectConfiguration;
import com.parlayarchitect.rules.ConfigurationHolder;
import com.parlayarchitect.scoring.WeightCalculator;
import com.parlayarchitect.tier.TierClassifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Entry point of the engine: turns a candidate pool and a request into exactly one
 * {@link SelectionResult}.
 *
 * <p>Pipeline for one request:
 * <ol>
 *   <li>Read the configuration snapshot once</li>
 *   <li>Validate the request against the closed profile set and {@code max-legs}</li>
 *   <li>Screen candidates at the intake boundary (malformed records are counted, not used)</li>
 *   <li>Eligibility gate, then tier and weight for every survivor</li>
 *   <li>Capture the {@link InventorySnapshot}</li>
 *   <li>INSUFFICIENT_POOL when fewer eligible legs than requested, otherwise run the ladder</li>
 *   <li>Write the audit record, publish {@link SelectionCompletedEvent}</li>
 * </ol>
 *
 * <p>Per-request problems always come back as a {@link SelectionResult.Rejected} carrying the
 * snapshot; this service does not throw for bad requests or bad data. The audit sink and the
 * event are only touched after the result is final, and a failing sink is logged without
 * affecting the result.
 */
@Service
public class ParlayArchitectService {

    private static final Logger log = LoggerFactory.getLogger(ParlayArchitectService.class);

    private final ConfigurationHolder configurationHolder;
    private final LegRecordParser legRecordParser;
    private final EligibilityGate eligibilityGate;
    private final TierClassifier tierClassifier;
    private final CorrelationGuard correlationGuard;
    private final WeightCalculator weightCalculator;
    private final LadderExecutor ladderExecutor;
    private final SelectionAssembler selectionAssembler;
    private final AuditRecordBuilder auditRecordBuilder;
    private final AuditSink auditSink;
    private final ApplicationEventPublisher applicationEventPublisher;

    public ParlayArchitectService(
            ConfigurationHolder configurationHolder,
            LegRecordParser legRecordParser,
            EligibilityGate eligibilityGate,
            TierClassifier tierClassifier,
            CorrelationGuard correlationGuard,
            WeightCalculator weightCalculator,
            LadderExecutor ladderExecutor,
            SelectionAssembler selectionAssembler,
            AuditRecordBuilder auditRecordBuilder,
            AuditSink auditSink,
            ApplicationEventPublisher applicationEventPublisher) {
        this.configurationHolder = configurationHolder;
        this.legRecordParser = legRecordParser;
        this.eligibilityGate = eligibilityGate;
        this.tierClassifier = tierClassifier;
        this.correlationGuard = correlationGuard;
        this.weightCalculator = weightCalculator;
        this.ladderExecutor = ladderExecutor;
        this.selectionAssembler = selectionAssembler;
        this.auditRecordBuilder = auditRecordBuilder;
        this.auditSink = auditSink;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Selects legs from typed candidates.
     */
    public SelectionResult buildParlay(SelectionRequest request, List<Leg> candidates) {
        long startNanos = System.nanoTime();
        return select(request, legRecordParser.screen(candidates), startNanos);
    }

    /**
     * Selects legs from raw upstream records (snake_case maps). Records the intake cannot turn
     * into legs are counted as MALFORMED in the diagnostic.
     */
    public SelectionResult buildParlayFromRecords(SelectionRequest request, List<Map<String, Object>> records) {
        long startNanos = System.nanoTime();
        return select(request, legRecordParser.parse(records), startNanos);
    }

    private SelectionResult select(SelectionRequest request, IntakeResult intake, long startNanos) {
        ArchitectConfiguration configuration = configurationHolder.current();

        RuleSet baseRules = null;
        String invalidReason = null;
        try {
            baseRules = validate(request, configuration);
        } catch (InvalidRequestException e) {
            invalidReason = e.getMessage();
        }

        boolean includeOptionalCategory = effectiveCategoryInclusion(request, baseRules);
        EligibilityResult eligibility = eligibilityGate.partition(intake.getLegs(), includeOptionalCategory);
        List<RankedLeg> pool = rank(eligibility.getEligible(), configuration);
        InventorySnapshot snapshot = snapshot(intake, eligibility, pool);

        SelectionResult result;
        LadderOutcome ladderOutcome = null;
        if (invalidReason != null) {
            result = SelectionResult.rejected(RejectionReason.INVALID_REQUEST, invalidReason, snapshot);
        } else if (snapshot.getEligibleTotal() < request.getLegCount()) {
            result = SelectionResult.rejected(
                    RejectionReason.INSUFFICIENT_POOL,
                    "Only " + snapshot.getEligibleTotal() + " eligible legs for " + request.getLegCount()
                            + " requested",
                    snapshot);
        } else {
            Comparator<RankedLeg> ranking = LegRanking.forPool(pool, request.getSeed()).comparator();
            List<RankedLeg> rankedPool = new ArrayList<>(pool);
            rankedPool.sort(ranking);

            ladderOutcome = ladderExecutor.execute(
                    rankedPool,
                    baseRules,
                    configuration.getFallbackLadder(),
                    request.getLegCount(),
                    request.isAllowSameEntity(),
                    request.isAllowSameEvent(),
                    ranking);
            result = toResult(request, ladderOutcome, snapshot);
        }

        logOutcome(request, result);
        writeAudit(request, includeOptionalCategory, baseRules, result, ladderOutcome);
        applicationEventPublisher.publishEvent(
                new SelectionCompletedEvent(this, request, result, System.nanoTime() - startNanos));
        return result;
    }

    // ========================
    // VALIDATION
    // ========================

    /**
     * Resolves the profile's rule set or throws {@link InvalidRequestException}.
     */
    private RuleSet validate(SelectionRequest request, ArchitectConfiguration configuration) {
        if (request == null) {
            throw new InvalidRequestException("Selection request is required");
        }
        RiskProfile profile = RiskProfile.fromName(request.getRiskProfile())
                .orElseThrow(() -> new InvalidRequestException(
                        "Unknown risk profile: '" + request.getRiskProfile() + "'",
                        Collections.singletonMap("riskProfile", request.getRiskProfile())));
        if (request.getLegCount() <= 0) {
            throw new InvalidRequestException(
                    "Leg count must be positive, got " + request.getLegCount(),
                    Map.of("legCount", request.getLegCount()));
        }
        if (request.getLegCount() > configuration.getMaxLegs()) {
            throw new InvalidRequestException(
                    "Leg count " + request.getLegCount() + " exceeds maximum of " + configuration.getMaxLegs(),
                    Map.of("legCount", request.getLegCount(), "maxLegs", configuration.getMaxLegs()));
        }
        return configuration.ruleSetFor(profile)
                .orElseThrow(() -> new InvalidRequestException(
                        "No rule set configured for profile " + profile, Map.of("riskProfile", profile.name())));
    }

    private static boolean effectiveCategoryInclusion(SelectionRequest request, RuleSet baseRules) {
        if (request != null && request.getIncludeOptionalCategory() != null) {
            return request.getIncludeOptionalCategory();
        }
        return baseRules != null && baseRules.isIncludeOptionalCategory();
    }

    // ========================
    // POOL & DIAGNOSTIC
    // ========================

    private List<RankedLeg> rank(List<Leg> eligible, ArchitectConfiguration configuration) {
        List<RankedLeg> pool = new ArrayList<>(eligible.size());
        for (Leg leg : eligible) {
            Tier tier = tierClassifier.classify(leg, configuration.getTierThresholds());
            pool.add(new RankedLeg(leg, tier, weightCalculator.legWeight(leg, tier)));
        }
        return pool;
    }

    private InventorySnapshot snapshot(IntakeResult intake, EligibilityResult eligibility, List<RankedLeg> pool) {
        Map<Tier, Integer> byTier = InventorySnapshot.zeroCounts(Tier.class);
        Map<MarketCategory, Integer> byCategory = InventorySnapshot.zeroCounts(MarketCategory.class);
        for (RankedLeg rankedLeg : pool) {
            byTier.merge(rankedLeg.getTier(), 1, Integer::sum);
            byCategory.merge(rankedLeg.getLeg().getMarketCategory(), 1, Integer::sum);
        }

        Map<BlockReason, Integer> blocked = InventorySnapshot.zeroCounts(BlockReason.class);
        blocked.putAll(eligibility.getBlockedCounts());
        blocked.put(BlockReason.MALFORMED, intake.getMalformedCount());

        return InventorySnapshot.builder()
                .totalCandidates(intake.getTotalRecords())
                .eligibleTotal(pool.size())
                .eligibleByTier(Collections.unmodifiableMap(byTier))
                .blockedCounts(Collections.unmodifiableMap(blocked))
                .eligibleByCategory(Collections.unmodifiableMap(byCategory))
                .correlationUncheckedCount(correlationGuard.countUnchecked(eligibility.getEligible()))
                .build();
    }

    // ========================
    // RESULT
    // ========================

    private SelectionResult toResult(SelectionRequest request, LadderOutcome outcome, InventorySnapshot snapshot) {
        if (!outcome.isAccepted()) {
            return SelectionResult.rejected(
                    RejectionReason.NO_VALID_SELECTION,
                    "No combination of " + request.getLegCount() + " legs satisfied any relaxation step",
                    snapshot);
        }
        Assembly assembly = outcome.getAssembly();
        return SelectionResult.accepted(
                request.getLegCount(),
                assembly.getLegs(),
                assembly.getAggregateWeight(),
                outcome.getAcceptedAt().getIndex(),
                outcome.getRulesApplied(),
                selectionAssembler.shortfalls(assembly.getLegs(), outcome.getRulesApplied()),
                snapshot);
    }

    private void logOutcome(SelectionRequest request, SelectionResult result) {
        if (result instanceof SelectionResult.Accepted accepted) {
            log.info(
                    "Parlay accepted: profile={}, legs={}, step={}, weight={}, ids={}",
                    request.getRiskProfile(),
                    accepted.getLegs().size(),
                    accepted.getRelaxationStep(),
                    String.format("%.4f", accepted.getAggregateWeight()),
                    accepted.getLegs().stream().map(RankedLeg::getId).toList());
        } else if (result instanceof SelectionResult.Rejected rejected) {
            InventorySnapshot diagnostic = rejected.getDiagnostic();
            log.warn(
                    "Parlay rejected: reason={}, message={}, eligible={}, byTier={}, blocked={}",
                    rejected.getReasonCode(),
                    rejected.getMessage(),
                    diagnostic.getEligibleTotal(),
                    diagnostic.getEligibleByTier(),
                    diagnostic.getBlockedCounts());
        }
    }

    private void writeAudit(
            SelectionRequest request,
            boolean includeOptionalCategory,
            RuleSet baseRules,
            SelectionResult result,
            LadderOutcome ladderOutcome) {
        try {
            AuditRecord auditRecord =
                    auditRecordBuilder.build(request, includeOptionalCategory, baseRules, result, ladderOutcome);
            auditSink.write(auditRecord);
        } catch (RuntimeException e) {
            log.error("Failed to write selection audit record for status {}: {}", result.getStatus(), e.getMessage(), e);
        }
    }
}
