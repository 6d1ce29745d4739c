package ai.schemaflow.store.model;

public enum StageStatus {
    PENDING, RUNNING, DONE, FAILED, CANCELED
}
