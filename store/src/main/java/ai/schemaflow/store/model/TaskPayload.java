package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;

/**
 * The change a task applies to its target database.
 */
public record TaskPayload(
    String statement,
    @Nullable String schemaVersion
) {}
