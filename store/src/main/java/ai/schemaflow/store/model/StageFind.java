package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;
import lombok.Builder;

@Builder
public record StageFind(
    @Nullable Long id,
    @Nullable Long pipelineId,
    @Nullable Long environmentId,
    @Nullable Integer ordinal,
    @Nullable StageStatus status
) implements EntityFind {

    public static StageFind byId(long id) {
        return builder().id(id).build();
    }

    public static StageFind byPipeline(long pipelineId) {
        return builder().pipelineId(pipelineId).build();
    }

    @Override
    public boolean isPointLookup() {
        return id != null && pipelineId == null && environmentId == null && ordinal == null && status == null;
    }
}
