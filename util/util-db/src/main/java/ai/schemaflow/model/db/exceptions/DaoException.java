package ai.schemaflow.model.db.exceptions;

/**
 * Base of every failure surfaced by the entity store.
 */
public abstract class DaoException extends Exception {

    /**
     * How the API layer is expected to report the failure.
     */
    public enum Code {
        STORE_ERROR(500),
        CONFLICT(409),
        NOT_FOUND(404),
        INVALID_TRANSITION(400),
        STALE_VERSION(412);

        private final int httpStatus;

        Code(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    protected DaoException(String message) {
        super(message);
    }

    protected DaoException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract Code code();
}
