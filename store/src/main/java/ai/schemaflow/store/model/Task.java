package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;

import java.time.Instant;

public record Task(
    long id,
    long creatorId,
    Instant createdTs,
    long updaterId,
    Instant updatedTs,
    long version,
    long pipelineId,
    long stageId,
    @Nullable Long databaseId,
    String name,
    String type,
    TaskStatus status,
    TaskPayload payload,
    @Nullable TaskResult result
) implements RawEntity<TaskStatus> {}
