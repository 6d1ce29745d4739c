package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;

public interface EntityFind {
    @Nullable
    Long id();

    /**
     * {@code true} if the request filters by id and nothing else, so it can be served from the cache.
     */
    boolean isPointLookup();
}
