package com.parlayarchitect.domain.model;

import com.parlayarchitect.domain.enums.Tier;
import lombok.Value;

/**
 * An eligible leg together with its request-scoped tier and weight.
 */
@Value
public class RankedLeg {

    Leg leg;
    Tier tier;
    double weight;

    public String getId() {
        return leg.getId();
    }
}
