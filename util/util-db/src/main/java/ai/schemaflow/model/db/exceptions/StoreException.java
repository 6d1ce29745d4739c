package ai.schemaflow.model.db.exceptions;

import ai.schemaflow.model.db.DbHelper;
import jakarta.annotation.Nullable;

import java.sql.SQLException;

public class StoreException extends DaoException {
    private final String operation;

    public StoreException(String operation, SQLException cause) {
        super("Failed to %s: %s".formatted(operation, cause.getMessage()), cause);
        this.operation = operation;
    }

    public StoreException(String operation, String reason) {
        super("Failed to %s: %s".formatted(operation, reason));
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }

    @Nullable
    public String sqlState() {
        return getCause() instanceof SQLException e ? DbHelper.rootSqlState(e) : null;
    }

    public boolean isUniqueViolation() {
        return getCause() instanceof SQLException e && DbHelper.isUniqueViolation(e);
    }

    public boolean isForeignKeyViolation() {
        return getCause() instanceof SQLException e && DbHelper.isForeignKeyViolation(e);
    }

    /**
     * The statement ran past its query timeout and was aborted by the driver.
     */
    public boolean isQueryCanceled() {
        return getCause() instanceof SQLException e && DbHelper.isQueryCanceled(e);
    }

    @Override
    public Code code() {
        return Code.STORE_ERROR;
    }
}
