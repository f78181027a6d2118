package com.parlayarchitect.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable input of a single selection.
 *
 * <p>The risk profile is kept as the caller-supplied name; it is resolved against the closed
 * {@code RiskProfile} set during request validation so that a malformed name surfaces as an
 * INVALID_REQUEST rejection rather than an exception.
 *
 * <p>{@code includeOptionalCategory} may be null, in which case the profile's configured default
 * applies.
 */
@Value
@Builder(toBuilder = true)
public class SelectionRequest {

    int legCount;

    String riskProfile;

    boolean allowSameEntity;

    /** Lifts the per-event leg limit of the profile. */
    boolean allowSameEvent;

    Boolean includeOptionalCategory;

    /** Source of all tie-break randomness for this request. */
    long seed;
}
