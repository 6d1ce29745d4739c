package ai.schemaflow.store.model;

public enum EntityKind {
    PIPELINE("pipeline"),
    STAGE("stage"),
    TASK("task"),
    ISSUE("issue");

    private final String table;

    EntityKind(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }

    @Override
    public String toString() {
        return table;
    }
}
