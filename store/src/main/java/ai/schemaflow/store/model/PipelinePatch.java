package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;
import lombok.Builder;

@Builder
public record PipelinePatch(
    long id,
    long updaterId,
    @Nullable String name,
    @Nullable PipelineStatus status,
    @Nullable Long expectedVersion
) implements EntityPatch<PipelineStatus> {}
