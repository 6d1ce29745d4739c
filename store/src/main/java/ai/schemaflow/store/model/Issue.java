package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;

import java.time.Instant;

public record Issue(
    long id,
    long creatorId,
    Instant createdTs,
    long updaterId,
    Instant updatedTs,
    long version,
    long projectId,
    @Nullable Long pipelineId,
    String name,
    String type,
    String description,
    @Nullable Long assigneeId,
    IssueStatus status
) implements RawEntity<IssueStatus> {}
