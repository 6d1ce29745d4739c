package ai.schemaflow.store.model;

public enum IssueStatus {
    OPEN, DONE, CANCELED
}
