package ai.schemaflow.store.model;

public enum PipelineStatus {
    OPEN, DONE, CANCELED
}
