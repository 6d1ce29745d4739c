package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;

public record TaskCreate(
    long creatorId,
    long stageId,
    @Nullable Long databaseId,
    String name,
    String type,
    TaskPayload payload
) implements EntityCreate {}
