package ai.schemaflow.store.model;

public interface EntityCreate {
    long creatorId();
}
