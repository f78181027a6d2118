package com.parlayarchitect.domain.enums;

/**
 * Discriminator of the terminal selection outcome.
 */
public enum SelectionStatus {
    ACCEPTED,
    REJECTED
}
