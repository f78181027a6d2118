package com.parlayarchitect.domain.model;

import com.parlayarchitect.domain.enums.Tier;
import lombok.Value;

/**
 * A soft tier minimum that an accepted selection did not meet.
 */
@Value
public class TierShortfall {

    Tier tier;
    int preferred;
    int actual;
}
