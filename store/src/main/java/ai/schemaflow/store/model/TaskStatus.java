package ai.schemaflow.store.model;

public enum TaskStatus {
    PENDING, RUNNING, DONE, FAILED, CANCELED
}
