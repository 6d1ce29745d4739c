package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;

public record TaskResult(
    String detail,
    @Nullable String migrationId
) {}
