package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;
import lombok.Builder;

@Builder
public record PipelineFind(
    @Nullable Long id,
    @Nullable PipelineStatus status
) implements EntityFind {

    public static PipelineFind byId(long id) {
        return builder().id(id).build();
    }

    @Override
    public boolean isPointLookup() {
        return id != null && status == null;
    }
}
