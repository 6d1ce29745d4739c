package ai.schemaflow.model.db.exceptions;

public class ConflictException extends DaoException {
    private final int expected;
    private final int actual;

    public ConflictException(String entity, Object filter, int expected, int actual) {
        super("found %d %s with filter %s, expect %d".formatted(actual, entity, filter, expected));
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }

    @Override
    public Code code() {
        return Code.CONFLICT;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
