package com.parlayarchitect.domain.enums;

/**
 * Exhaustive failure taxonomy for a selection request.
 *
 * <ul>
 *   <li>INSUFFICIENT_POOL -- fewer eligible legs than requested; the ladder is skipped</li>
 *   <li>NO_VALID_SELECTION -- every ladder step was attempted and none met its criteria</li>
 *   <li>INVALID_REQUEST -- malformed profile, non-positive or oversized leg count, or no
 *       configuration for the requested profile</li>
 * </ul>
 */
public enum RejectionReason {
    INSUFFICIENT_POOL,
    NO_VALID_SELECTION,
    INVALID_REQUEST
}
