package ai.schemaflow.store.model;

import java.time.Instant;

public record Pipeline(
    long id,
    long creatorId,
    Instant createdTs,
    long updaterId,
    Instant updatedTs,
    long version,
    String name,
    PipelineStatus status
) implements RawEntity<PipelineStatus> {}
