package com.parlayarchitect.domain.model;

import com.parlayarchitect.domain.enums.MarketCategory;
import com.parlayarchitect.domain.enums.QualitySignal;
import com.parlayarchitect.domain.enums.VolatilityClass;
import lombok.Builder;
import lombok.Value;

/**
 * A single candidate leg produced by the upstream scoring service.
 *
 * <p>Legs are built fresh per request (usually by the {@code LegRecordParser} at the intake
 * boundary) and are immutable for the duration of a selection. The engine never persists them.
 *
 * <p>Two orthogonal hard gates travel with every leg:
 * <ul>
 *   <li><b>Gate A</b> -- data integrity of the simulation behind the leg</li>
 *   <li><b>Gate B</b> -- validity of the market the leg is priced against</li>
 * </ul>
 * A leg failing either gate is never selectable, at any relaxation step.
 *
 * <p>{@code entityKey} groups legs that share an underlying subject (team, player). It may be
 * null; such legs bypass the correlation check and are counted as correlation-unchecked.
 */
@Value
@Builder(toBuilder = true)
public class Leg {

    String id;

    /** Correlation grouping key. Null when upstream did not supply one. */
    String entityKey;

    /** Event the leg belongs to. Null when unknown; such legs are not limited per event. */
    String eventId;

    /** Display label, e.g. "Bulls +10.5". */
    String selection;

    QualitySignal qualitySignal;

    /** Normalised confidence in [0,1]. */
    double confidence;

    VolatilityClass volatility;

    MarketCategory marketCategory;

    boolean gateAPassed;

    boolean gateBPassed;

    /** Expected value; a small positive bonus when present, never a penalty. */
    @Builder.Default
    double expectedValue = 0.0;

    /** Closing line value in percent points. */
    @Builder.Default
    double closingLineValue = 0.0;

    /** Model total minus the book total, in points. Only its magnitude counts. */
    @Builder.Default
    double totalDeviation = 0.0;

    @Builder.Default
    boolean injuryStable = true;

    /** True when the underlying market is locked and the price may be stale. */
    @Builder.Default
    boolean locked = false;

    public boolean hasEntityKey() {
        return entityKey != null && !entityKey.isBlank();
    }

    public boolean hasEventId() {
        return eventId != null && !eventId.isBlank();
    }
}
