package ai.schemaflow.store.cache;

import ai.schemaflow.store.model.EntityKind;
import ai.schemaflow.store.model.RawEntity;

import java.util.Optional;

/**
 * Point-lookup cache of committed entity snapshots, keyed by {@code (kind, id)}.
 *
 * <p>Only ever consulted for single-id lookups. Entries are written after commit, so a reader can observe a
 * snapshot older than the store but never one the store has not committed.
 */
public interface EntityCache {

    <E extends RawEntity<?>> Optional<E> find(EntityKind kind, long id, Class<E> type);

    void upsert(EntityKind kind, long id, RawEntity<?> entity);

    /**
     * Drops the entry, so the next point lookup reads the store.
     */
    void invalidate(EntityKind kind, long id);
}
