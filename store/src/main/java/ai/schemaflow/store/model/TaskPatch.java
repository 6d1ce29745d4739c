package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;
import lombok.Builder;

@Builder
public record TaskPatch(
    long id,
    long updaterId,
    @Nullable TaskStatus status,
    @Nullable TaskPayload payload,
    @Nullable TaskResult result,
    @Nullable Long expectedVersion
) implements EntityPatch<TaskStatus> {}
