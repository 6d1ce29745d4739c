package ai.schemaflow.model.db;

import java.sql.Connection;
import java.sql.SQLException;

public interface Storage {

    Connection connect() throws SQLException;

    default int isolationLevel() {
        return Connection.TRANSACTION_READ_COMMITTED;
    }
}
