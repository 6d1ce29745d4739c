package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;
import lombok.Builder;

import java.util.List;

@Builder
public record TaskFind(
    @Nullable Long id,
    @Nullable Long pipelineId,
    @Nullable Long stageId,
    @Nullable Long databaseId,
    @Nullable List<TaskStatus> statusList
) implements EntityFind {

    public static TaskFind byId(long id) {
        return builder().id(id).build();
    }

    @Override
    public boolean isPointLookup() {
        return id != null && pipelineId == null && stageId == null && databaseId == null && statusList == null;
    }
}
