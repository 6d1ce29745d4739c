package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;
import lombok.Builder;

@Builder
public record StagePatch(
    long id,
    long updaterId,
    @Nullable String name,
    @Nullable StageStatus status,
    @Nullable Long expectedVersion
) implements EntityPatch<StageStatus> {}
