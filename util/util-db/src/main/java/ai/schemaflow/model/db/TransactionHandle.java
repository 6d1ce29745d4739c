package ai.schemaflow.model.db;

import jakarta.annotation.Nullable;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A lazily opened store transaction.
 *
 * <p>Closing a handle that was not committed rolls the transaction back. Callbacks registered with
 * {@link #afterCommit(Runnable)} run only once the outermost transaction has been committed.
 */
public interface TransactionHandle extends AutoCloseable {

    Connection connect() throws SQLException;

    void commit() throws SQLException;

    void afterCommit(Runnable action);

    @Override
    void close() throws SQLException;

    static TransactionHandle create(Storage storage) {
        return new TransactionHandleImpl(storage);
    }

    static TransactionHandle getOrCreate(Storage storage, @Nullable TransactionHandle transaction) {
        return new DelegatingTransactionHandle(storage, transaction);
    }

}
