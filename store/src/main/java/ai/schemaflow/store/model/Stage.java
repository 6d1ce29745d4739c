package ai.schemaflow.store.model;

import java.time.Instant;

public record Stage(
    long id,
    long creatorId,
    Instant createdTs,
    long updaterId,
    Instant updatedTs,
    long version,
    long pipelineId,
    long environmentId,
    int ordinal,
    String name,
    StageStatus status
) implements RawEntity<StageStatus> {}
