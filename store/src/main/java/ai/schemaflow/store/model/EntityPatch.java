package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;

/**
 * A partial update. Every nullable field left {@code null} keeps the stored value.
 */
public interface EntityPatch<S extends Enum<S>> {
    long id();

    long updaterId();

    @Nullable
    S status();

    /**
     * When set, the patch is rejected unless the stored version is exactly this value.
     */
    @Nullable
    Long expectedVersion();
}
