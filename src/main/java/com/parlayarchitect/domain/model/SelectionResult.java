package com.parlayarchitect.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.parlayarchitect.domain.enums.RejectionReason;
import com.parlayarchitect.domain.enums.SelectionStatus;
import java.util.List;
import java.util.Objects;

/**
 * Terminal outcome of a selection request: exactly one of {@link Accepted} or {@link Rejected}.
 *
 * <p>Serialised to JSON with an explicit {@code status} discriminator ("ACCEPTED" /
 * "REJECTED"). Both variants carry the pre-ladder {@link InventorySnapshot} so callers always
 * get the full diagnostic picture.
 *
 * <p>An accepted result always holds exactly the requested number of legs; the factory refuses
 * to build anything else.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SelectionResult.Accepted.class, name = "ACCEPTED"),
    @JsonSubTypes.Type(value = SelectionResult.Rejected.class, name = "REJECTED")
})
public abstract class SelectionResult {

    private final InventorySnapshot diagnostic;

    private SelectionResult(InventorySnapshot diagnostic) {
        this.diagnostic = Objects.requireNonNull(diagnostic, "diagnostic");
    }

    public InventorySnapshot getDiagnostic() {
        return diagnostic;
    }

    @JsonIgnore
    public abstract SelectionStatus getStatus();

    @JsonIgnore
    public boolean isAccepted() {
        return getStatus() == SelectionStatus.ACCEPTED;
    }

    @JsonIgnore
    public boolean isRejected() {
        return !isAccepted();
    }

    public static Accepted accepted(
            int legCount,
            List<RankedLeg> legs,
            double aggregateWeight,
            int relaxationStep,
            RuleSet rulesApplied,
            List<TierShortfall> preferenceShortfalls,
            InventorySnapshot diagnostic) {
        if (legs == null || legs.size() != legCount) {
            throw new IllegalArgumentException("Accepted selection must hold exactly " + legCount + " legs, got "
                    + (legs == null ? 0 : legs.size()));
        }
        return new Accepted(
                List.copyOf(legs),
                aggregateWeight,
                relaxationStep,
                rulesApplied,
                preferenceShortfalls == null ? List.of() : List.copyOf(preferenceShortfalls),
                diagnostic);
    }

    public static Rejected rejected(RejectionReason reasonCode, String message, InventorySnapshot diagnostic) {
        return new Rejected(Objects.requireNonNull(reasonCode, "reasonCode"), message, diagnostic);
    }

    // ========================
    // VARIANTS
    // ========================

    @JsonPropertyOrder({"status", "relaxationStep", "aggregateWeight", "legs", "rulesApplied"})
    public static final class Accepted extends SelectionResult {

        private final List<RankedLeg> legs;
        private final double aggregateWeight;
        private final int relaxationStep;
        private final RuleSet rulesApplied;
        private final List<TierShortfall> preferenceShortfalls;

        private Accepted(
                List<RankedLeg> legs,
                double aggregateWeight,
                int relaxationStep,
                RuleSet rulesApplied,
                List<TierShortfall> preferenceShortfalls,
                InventorySnapshot diagnostic) {
            super(diagnostic);
            this.legs = legs;
            this.aggregateWeight = aggregateWeight;
            this.relaxationStep = relaxationStep;
            this.rulesApplied = rulesApplied;
            this.preferenceShortfalls = preferenceShortfalls;
        }

        @Override
        public SelectionStatus getStatus() {
            return SelectionStatus.ACCEPTED;
        }

        public List<RankedLeg> getLegs() {
            return legs;
        }

        public double getAggregateWeight() {
            return aggregateWeight;
        }

        public int getRelaxationStep() {
            return relaxationStep;
        }

        public RuleSet getRulesApplied() {
            return rulesApplied;
        }

        public List<TierShortfall> getPreferenceShortfalls() {
            return preferenceShortfalls;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Accepted other)) {
                return false;
            }
            return Double.compare(aggregateWeight, other.aggregateWeight) == 0
                    && relaxationStep == other.relaxationStep
                    && legs.equals(other.legs)
                    && Objects.equals(rulesApplied, other.rulesApplied)
                    && preferenceShortfalls.equals(other.preferenceShortfalls)
                    && getDiagnostic().equals(other.getDiagnostic());
        }

        @Override
        public int hashCode() {
            return Objects.hash(legs, aggregateWeight, relaxationStep, rulesApplied, getDiagnostic());
        }

        @Override
        public String toString() {
            return "ACCEPTED[step=" + relaxationStep + ", weight=" + aggregateWeight + ", legs="
                    + legs.stream().map(RankedLeg::getId).toList() + "]";
        }
    }

    @JsonPropertyOrder({"status", "reasonCode", "message", "diagnostic"})
    public static final class Rejected extends SelectionResult {

        private final RejectionReason reasonCode;
        private final String message;

        private Rejected(RejectionReason reasonCode, String message, InventorySnapshot diagnostic) {
            super(diagnostic);
            this.reasonCode = reasonCode;
            this.message = message;
        }

        @Override
        public SelectionStatus getStatus() {
            return SelectionStatus.REJECTED;
        }

        public RejectionReason getReasonCode() {
            return reasonCode;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Rejected other)) {
                return false;
            }
            return reasonCode == other.reasonCode
                    && Objects.equals(message, other.message)
                    && getDiagnostic().equals(other.getDiagnostic());
        }

        @Override
        public int hashCode() {
            return Objects.hash(reasonCode, message, getDiagnostic());
        }

        @Override
        public String toString() {
            return "REJECTED[" + reasonCode + ": " + message + "]";
        }
    }
}
