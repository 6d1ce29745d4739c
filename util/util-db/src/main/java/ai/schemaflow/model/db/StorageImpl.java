package ai.schemaflow.model.db;

import com.mchange.v2.c3p0.ComboPooledDataSource;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flywaydb.core.Flyway;

import java.sql.Connection;
import java.sql.SQLException;

public abstract class StorageImpl implements Storage {
    private static final Logger LOG = LogManager.getLogger(StorageImpl.class);

    private static final String VALIDATION_QUERY_SQL = "select 1";

    private final ComboPooledDataSource dataSource;

    protected StorageImpl(DatabaseConfiguration dbConfig, String migrationsPath) {
        this(dbConfig, migrationsPath, "flyway_schema_history");
    }

    protected StorageImpl(DatabaseConfiguration dbConfig, String migrationsPath, String historyTable) {
        dataSource = new ComboPooledDataSource();
        dataSource.setJdbcUrl(dbConfig.getUrl());
        dataSource.setUser(dbConfig.getUsername());
        dataSource.setPassword(dbConfig.getPassword());

        dataSource.setMinPoolSize(dbConfig.getMinPoolSize());
        dataSource.setMaxPoolSize(dbConfig.getMaxPoolSize());

        dataSource.setTestConnectionOnCheckout(true);
        dataSource.setPreferredTestQuery(VALIDATION_QUERY_SQL);

        var flyway = Flyway.configure()
            .table(historyTable)
            .dataSource(dbConfig.getUrl(), dbConfig.getUsername(), dbConfig.getPassword())
            .locations(migrationsPath)
            .load();
        var result = flyway.migrate();
        LOG.info("Database migrated, {} migrations applied from {}", result.migrationsExecuted, migrationsPath);
    }

    @Override
    public final Connection connect() throws SQLException {
        var conn = dataSource.getConnection();
        conn.setAutoCommit(true);
        conn.setTransactionIsolation(isolationLevel());
        return conn;
    }

    @PreDestroy
    public void close() {
        dataSource.close();
    }

    @Override
    public int isolationLevel() {
        return Connection.TRANSACTION_READ_COMMITTED;
    }
}
