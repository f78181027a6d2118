package com.parlayarchitect.domain.enums;

/**
 * Market category of a leg.
 *
 * <p>Optional categories (proposition markets) are excluded from the pool unless the request,
 * or the profile default, explicitly includes them.
 */
public enum MarketCategory {
    SPREAD(false),
    TOTAL(false),
    MONEYLINE(false),
    PROP(true);

    private final boolean optional;

    MarketCategory(boolean optional) {
        this.optional = optional;
    }

    public boolean isOptional() {
        return optional;
    }
}
