package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;

/**
 * @param ordinal position within the pipeline; {@code null} appends the stage after the last one
 */
public record StageCreate(
    long creatorId,
    long pipelineId,
    long environmentId,
    String name,
    @Nullable Integer ordinal
) implements EntityCreate {}
