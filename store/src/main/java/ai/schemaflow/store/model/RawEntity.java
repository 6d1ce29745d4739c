package ai.schemaflow.store.model;

import java.time.Instant;

/**
 * Store-level snapshot of a row. Implementations are immutable, so a snapshot can be shared between the
 * cache and any number of callers.
 */
public interface RawEntity<S extends Enum<S>> {
    long id();

    long creatorId();

    Instant createdTs();

    long updaterId();

    Instant updatedTs();

    /**
     * Starts at 1 and grows by one with every committed patch.
     */
    long version();

    S status();
}
