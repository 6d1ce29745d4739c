package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;

public record IssueCreate(
    long creatorId,
    long projectId,
    @Nullable Long pipelineId,
    String name,
    String type,
    String description,
    @Nullable Long assigneeId
) implements EntityCreate {}
