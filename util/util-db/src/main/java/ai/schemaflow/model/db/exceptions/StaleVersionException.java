package ai.schemaflow.model.db.exceptions;

public class StaleVersionException extends DaoException {
    private final long expected;
    private final long actual;

    public StaleVersionException(String entity, long id, long expected, long actual) {
        super("%s %d was modified concurrently: expected version %d, actual %d"
            .formatted(entity, id, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }

    @Override
    public Code code() {
        return Code.STALE_VERSION;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
