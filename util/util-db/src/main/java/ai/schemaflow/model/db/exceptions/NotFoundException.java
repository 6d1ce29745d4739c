package ai.schemaflow.model.db.exceptions;

public class NotFoundException extends DaoException {
    private final String entity;
    private final long id;

    public NotFoundException(String entity, long id) {
        super("%s ID not found: %d".formatted(entity, id));
        this.entity = entity;
        this.id = id;
    }

    public String entity() {
        return entity;
    }

    public long id() {
        return id;
    }

    @Override
    public Code code() {
        return Code.NOT_FOUND;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
