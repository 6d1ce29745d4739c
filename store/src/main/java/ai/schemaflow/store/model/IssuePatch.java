package ai.schemaflow.store.model;

import jakarta.annotation.Nullable;
import lombok.Builder;

@Builder
public record IssuePatch(
    long id,
    long updaterId,
    @Nullable String name,
    @Nullable String description,
    @Nullable Long assigneeId,
    @Nullable IssueStatus status,
    @Nullable Long expectedVersion
) implements EntityPatch<IssueStatus> {}
