package ai.schemaflow.store.model;

public record PipelineCreate(long creatorId, String name) implements EntityCreate {}
