package com.parlayarchitect.correlation;

import com.parlayarchitect.domain.model.Leg;
import java.util.Collection;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Same-entity exclusion: at most one leg per entity key in a selection.
 *
 * <p>The check is bypassed entirely when the request allows same-entity legs. Legs without an
 * entity key are treated as unique so they are never falsely rejected; they are logged and
 * counted as correlation-unchecked in the inventory snapshot, because a feed that drops keys
 * systematically would hide real correlation.
 *
 * <p>Never relaxed by the fallback ladder.
 */
@Component
public class CorrelationGuard {

    private static final Logger log = LoggerFactory.getLogger(CorrelationGuard.class);

    /**
     * Returns true when adding {@code candidate} to a selection whose entity keys are
     * {@code usedEntityKeys} would put two legs of the same entity together.
     */
    public boolean violates(Set<String> usedEntityKeys, Leg candidate, boolean allowSameEntity) {
        if (allowSameEntity || !candidate.hasEntityKey()) {
            return false;
        }
        return usedEntityKeys.contains(candidate.getEntityKey());
    }

    /**
     * Counts legs that will bypass the guard for lack of an entity key, logging a warning when
     * there are any.
     */
    public int countUnchecked(Collection<Leg> legs) {
        int unchecked = 0;
        for (Leg leg : legs) {
            if (!leg.hasEntityKey()) {
                unchecked++;
                log.warn("Leg {} has no entity key; correlation check skipped for it", leg.getId());
            }
        }
        return unchecked;
    }
}
