package ai.schemaflow.model.db.exceptions;

public class InvalidTransitionException extends DaoException {
    private final String entity;
    private final long id;
    private final Enum<?> from;
    private final Enum<?> to;

    public InvalidTransitionException(String entity, long id, Enum<?> from, Enum<?> to) {
        this(entity, id, from, to, "transition is not allowed");
    }

    public InvalidTransitionException(String entity, long id, Enum<?> from, Enum<?> to, String reason) {
        super("Invalid %s %d status transition %s -> %s: %s".formatted(entity, id, from, to, reason));
        this.entity = entity;
        this.id = id;
        this.from = from;
        this.to = to;
    }

    public String entity() {
        return entity;
    }

    public long id() {
        return id;
    }

    public Enum<?> from() {
        return from;
    }

    public Enum<?> to() {
        return to;
    }

    @Override
    public Code code() {
        return Code.INVALID_TRANSITION;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
