package com.parlayarchitect.rules;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the current {@link ArchitectConfiguration} and swaps it atomically on reload.
 *
 * <p>Readers call {@link #current()} once per request. A reload replaces the whole snapshot;
 * there is no partial update path.
 */
public class ConfigurationHolder {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationHolder.class);

    private final AtomicReference<ArchitectConfiguration> snapshot;

    public ConfigurationHolder(ArchitectConfiguration initial) {
        this.snapshot = new AtomicReference<>(Objects.requireNonNull(initial, "initial configuration"));
    }

    public ArchitectConfiguration current() {
        return snapshot.get();
    }

    /**
     * Replaces the active snapshot. The new snapshot must already be validated.
     *
     * @return the snapshot that was replaced
     */
    public ArchitectConfiguration reload(ArchitectConfiguration next) {
        ArchitectConfiguration previous = snapshot.getAndSet(Objects.requireNonNull(next, "configuration"));
        log.info("Architect configuration reloaded: profiles={}, maxLegs={}", next.getRuleSets().keySet(),
                next.getMaxLegs());
        return previous;
    }
}
