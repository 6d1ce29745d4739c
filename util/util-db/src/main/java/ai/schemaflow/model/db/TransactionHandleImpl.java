package ai.schemaflow.model.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public final class TransactionHandleImpl implements TransactionHandle {
    private static final Logger LOG = LogManager.getLogger(TransactionHandleImpl.class);

    private final Storage storage;
    private final List<Runnable> afterCommitActions = new ArrayList<>();
    private boolean committed = false;
    private Connection con = null;

    TransactionHandleImpl(Storage storage) {
        this.storage = storage;
    }

    public synchronized Connection connect() throws SQLException {
        if (con != null) {
            return con;
        }
        con = storage.connect();
        con.setAutoCommit(false);
        con.setTransactionIsolation(storage.isolationLevel());
        return con;
    }

    public synchronized void commit() throws SQLException {
        if (committed) {
            throw new IllegalStateException("Already committed");
        }
        if (con != null) {
            con.commit();
        }
        committed = true;

        for (var action : afterCommitActions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                LOG.error("After-commit action failed: {}", e.getMessage(), e);
            }
        }
        afterCommitActions.clear();
    }

    @Override
    public synchronized void afterCommit(Runnable action) {
        if (committed) {
            throw new IllegalStateException("Transaction is already committed");
        }
        afterCommitActions.add(action);
    }

    @Override
    public synchronized void close() throws SQLException {
        afterCommitActions.clear();
        if (con == null || con.isClosed()) {
            return;
        }
        try {
            if (!committed) {
                con.rollback();
            }
            con.setAutoCommit(true);
        } finally {
            con.close();
            con = null;
        }
    }
}
