package com.parlayarchitect.domain.enums;

/**
 * Why a candidate never entered the eligible pool.
 *
 * <p>BOTH is tracked separately from GATE_A and GATE_B so that correlated integrity failures
 * are visible in diagnostics. MALFORMED counts records rejected at the intake boundary.
 */
public enum BlockReason {
    GATE_A,
    GATE_B,
    BOTH,
    CATEGORY_EXCLUDED,
    MALFORMED
}
