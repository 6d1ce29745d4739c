package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;
import lombok.Builder;

@Builder
public record IssueFind(
    @Nullable Long id,
    @Nullable Long projectId,
    @Nullable Long pipelineId,
    @Nullable Long assigneeId,
    @Nullable IssueStatus status
) implements EntityFind {

    public static IssueFind byId(long id) {
        return builder().id(id).build();
    }

    @Override
    public boolean isPointLookup() {
        return id != null && projectId == null && pipelineId == null && assigneeId == null && status == null;
    }
}
