package ai.schemaflow.store.services;

import ai.schemaflow.model.db.DbHelper;
import ai.schemaflow.model.db.Storage;
import ai.schemaflow.model.db.TransactionHandle;
import ai.schemaflow.model.db.exceptions.ConflictException;
import ai.schemaflow.model.db.exceptions.DaoException;
import ai.schemaflow.model.db.exceptions.NotFoundException;
import ai.schemaflow.model.db.exceptions.StaleVersionException;
import ai.schemaflow.model.db.exceptions.StoreException;
import ai.schemaflow.model.db.sql.ClauseBuilder;
import ai.schemaflow.store.cache.EntityCache;
import ai.schemaflow.store.config.StoreConfig;
import ai.schemaflow.store.model.EntityCreate;
import ai.schemaflow.store.model.EntityFind;
import ai.schemaflow.store.model.EntityKind;
import ai.schemaflow.store.model.EntityPatch;
import ai.schemaflow.store.model.RawEntity;
import ai.schemaflow.store.statemachine.TransitionTable;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transactional create/find/patch of one entity kind with a write-through point-lookup cache.
 *
 * <p>Every operation takes an optional caller transaction. Without one the operation runs in its own
 * transaction; with one, the caller decides when to commit and all cache writes of the operation are
 * postponed until that commit. The cache is written only after a successful commit and is never consulted
 * for list queries.
 *
 * @param <S> status enum of the entity
 * @param <E> entity snapshot
 * @param <C> create request
 * @param <F> find request
 * @param <P> patch request
 */
public abstract class EntityService<S extends Enum<S>, E extends RawEntity<S>, C extends EntityCreate,
                                    F extends EntityFind, P extends EntityPatch<S>>
{
    private static final Logger LOG = LogManager.getLogger(EntityService.class);

    private static final List<String> STANDARD_COLUMNS = List.of(
        "id", "creator_id", "created_ts", "updater_id", "updated_ts", "version", "status");

    protected final EntityKind kind;
    protected final Storage storage;
    protected final EntityCache cache;

    private final Class<E> type;
    private final TransitionTable<S> transitions;
    private final int queryTimeoutSeconds;
    private final String selectStatement;

    protected EntityService(EntityKind kind, Class<E> type, TransitionTable<S> transitions,
                            List<String> domainColumns, Storage storage, EntityCache cache, StoreConfig config)
    {
        this.kind = kind;
        this.type = type;
        this.transitions = transitions;
        this.storage = storage;
        this.cache = cache;
        this.queryTimeoutSeconds = (int) Math.max(0, config.getQueryTimeout().toSeconds());
        this.selectStatement = "SELECT %s FROM %s".formatted(
            Stream.concat(STANDARD_COLUMNS.stream(), domainColumns.stream()).collect(Collectors.joining(", ")),
            kind.table());
    }

    protected abstract S initialStatus();

    protected abstract F findById(long id);

    /**
     * Domain columns of a new row, in insertion order. Standard columns are filled in by the caller.
     */
    protected abstract Map<String, Object> insertValues(Connection con, C create) throws SQLException, DaoException;

    protected abstract void appendFilters(F find, ClauseBuilder where);

    /**
     * Adds the non-null domain fields of the patch. Standard columns and status are handled by the caller.
     */
    protected abstract void appendAssignments(P patch, ClauseBuilder set) throws SQLException;

    protected abstract E fromResultSet(ResultSet rs) throws SQLException;

    /**
     * Called with the current row locked, before any UPDATE is issued.
     */
    protected void validateTransition(Connection con, E current, S to) throws SQLException, DaoException {
        transitions.check(kind.table(), current.id(), current.status(), to);
    }

    protected void afterCreate(TransactionHandle tx, E created) throws SQLException, DaoException {}

    protected void afterPatch(TransactionHandle tx, E before, E after) throws SQLException, DaoException {}

    public E create(C create) throws DaoException {
        return create(create, null);
    }

    public E create(C create, @Nullable TransactionHandle transaction) throws DaoException {
        LOG.info("Create {}: {}", kind, create);

        try (var tx = TransactionHandle.getOrCreate(storage, transaction)) {
            var con = tx.connect();

            var values = new LinkedHashMap<String, Object>();
            values.put("creator_id", create.creatorId());
            values.put("updater_id", create.creatorId());
            values.put("version", 1L);
            values.put("status", initialStatus());
            values.putAll(insertValues(con, create));

            var sql = "INSERT INTO %s (%s) VALUES (%s)".formatted(
                kind.table(),
                String.join(", ", values.keySet()),
                String.join(", ", Collections.nCopies(values.size(), "?")));

            long id;
            try (var st = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                st.setQueryTimeout(queryTimeoutSeconds);
                DbHelper.bind(st, 1, new ArrayList<>(values.values()));
                st.executeUpdate();

                try (var keys = st.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No id generated for new " + kind);
                    }
                    id = keys.getLong(1);
                }
            }

            var created = selectOne(con, id, false);
            if (created == null) {
                throw new SQLException("Cannot read back %s %d".formatted(kind, id));
            }

            afterCreate(tx, created);
            cacheOnCommit(tx, created);
            tx.commit();

            LOG.info("Created {} {}", kind, created.id());
            return created;
        } catch (SQLException e) {
            throw storeError("create " + kind, e);
        }
    }

    /**
     * @return the single matching entity or {@code null} if nothing matches
     * @throws ConflictException if the filter matches more than one entity
     */
    @Nullable
    public E find(F find) throws DaoException {
        return find(find, null);
    }

    @Nullable
    public E find(F find, @Nullable TransactionHandle transaction) throws DaoException {
        // A caller transaction may hold uncommitted changes, so it always reads the store.
        if (find.isPointLookup() && transaction == null) {
            long id = find.id();
            var cached = cache.find(kind, id, type);
            if (cached.isPresent()) {
                LOG.debug("Found {} {} in cache", kind, id);
                return cached.get();
            }
        }

        try (var tx = TransactionHandle.getOrCreate(storage, transaction)) {
            var list = selectList(tx.connect(), find);
            if (list.isEmpty()) {
                return null;
            }
            if (list.size() > 1) {
                throw new ConflictException(kind.table(), find, 1, list.size());
            }

            var entity = list.get(0);
            cacheOnCommit(tx, entity);
            tx.commit();
            return entity;
        } catch (SQLException e) {
            throw storeError("find " + kind, e);
        }
    }

    /**
     * Same as {@link #find} by id, but absence is an error.
     */
    public E get(long id) throws DaoException {
        return get(id, null);
    }

    public E get(long id, @Nullable TransactionHandle transaction) throws DaoException {
        var entity = find(findById(id), transaction);
        if (entity == null) {
            throw new NotFoundException(kind.table(), id);
        }
        return entity;
    }

    public List<E> findList(F find) throws DaoException {
        return findList(find, null);
    }

    public List<E> findList(F find, @Nullable TransactionHandle transaction) throws DaoException {
        try (var tx = TransactionHandle.getOrCreate(storage, transaction)) {
            var list = selectList(tx.connect(), find);
            for (var entity : list) {
                cacheOnCommit(tx, entity);
            }
            tx.commit();
            return list;
        } catch (SQLException e) {
            throw storeError("find %s list".formatted(kind), e);
        }
    }

    public E patch(P patch) throws DaoException {
        return patch(patch, null);
    }

    public E patch(P patch, @Nullable TransactionHandle transaction) throws DaoException {
        LOG.info("Patch {} {}: {}", kind, patch.id(), patch);

        try (var tx = TransactionHandle.getOrCreate(storage, transaction)) {
            var con = tx.connect();

            var current = selectOne(con, patch.id(), true);
            if (current == null) {
                throw new NotFoundException(kind.table(), patch.id());
            }

            var expectedVersion = patch.expectedVersion();
            if (expectedVersion != null && expectedVersion != current.version()) {
                throw new StaleVersionException(kind.table(), patch.id(), expectedVersion, current.version());
            }

            var status = patch.status();
            if (status != null && status != current.status()) {
                validateTransition(con, current, status);
            }

            var set = ClauseBuilder.assignments()
                .add("updater_id", patch.updaterId())
                .addRaw("updated_ts = CURRENT_TIMESTAMP")
                .addRaw("version = version + 1")
                .add("status", status);
            appendAssignments(patch, set);

            try (var st = prepare(con, "UPDATE %s SET %s WHERE id = ?".formatted(kind.table(), set.build()))) {
                DbHelper.bind(st, 1, set.args());
                DbHelper.bind(st, set.args().size() + 1, patch.id());
                if (st.executeUpdate() == 0) {
                    throw new NotFoundException(kind.table(), patch.id());
                }
            }

            var updated = selectOne(con, patch.id(), false);
            if (updated == null) {
                throw new NotFoundException(kind.table(), patch.id());
            }

            afterPatch(tx, current, updated);
            cacheOnCommit(tx, updated);
            tx.commit();

            if (current.status() != updated.status()) {
                LOG.info("{} {} status {} -> {}", kind, updated.id(), current.status(), updated.status());
            }
            return updated;
        } catch (SQLException e) {
            throw storeError("patch %s %d".formatted(kind, patch.id()), e);
        }
    }

    protected final PreparedStatement prepare(Connection con, String sql) throws SQLException {
        var st = con.prepareStatement(sql);
        st.setQueryTimeout(queryTimeoutSeconds);
        return st;
    }

    @Nullable
    protected final E selectOne(Connection con, long id, boolean forUpdate) throws SQLException {
        var sql = selectStatement + " WHERE id = ?" + (forUpdate ? " FOR UPDATE" : "");
        try (var st = prepare(con, sql)) {
            st.setLong(1, id);
            try (var rs = st.executeQuery()) {
                return rs.next() ? fromResultSet(rs) : null;
            }
        }
    }

    /**
     * Locks the given rows with {@code SELECT ... FOR UPDATE} in id order. Callers that update several rows
     * of one kind in a transaction take the locks up front, so they never hold a row lock of another kind
     * while waiting for one of these rows.
     */
    public void lockForUpdate(Collection<Long> ids, TransactionHandle transaction) throws DaoException {
        if (ids.isEmpty()) {
            return;
        }
        var sorted = new TreeSet<>(ids);
        var where = ClauseBuilder.conjunction().addIn("id", sorted);

        try {
            var con = transaction.connect();
            try (var st = prepare(con, "SELECT id FROM %s WHERE %s ORDER BY id FOR UPDATE"
                .formatted(kind.table(), where.build())))
            {
                DbHelper.bind(st, 1, where.args());
                st.executeQuery().close();
            }
            LOG.debug("Locked {} {} rows {}", sorted.size(), kind, sorted);
        } catch (SQLException e) {
            throw storeError("lock %s %s".formatted(kind, sorted), e);
        }
    }

    protected final void cacheOnCommit(TransactionHandle tx, E entity) {
        tx.afterCommit(() -> {
            try {
                cache.upsert(kind, entity.id(), entity);
            } catch (RuntimeException e) {
                // The row is committed, so the cached snapshot is behind it now.
                cache.invalidate(kind, entity.id());
                throw e;
            }
        });
    }

    private List<E> selectList(Connection con, F find) throws SQLException {
        var where = ClauseBuilder.conjunction().add("id", find.id());
        appendFilters(find, where);

        LOG.debug("Select {} where {}", kind, where);

        try (var st = prepare(con, selectStatement + " WHERE " + where.build() + " ORDER BY id")) {
            DbHelper.bind(st, 1, where.args());
            try (var rs = st.executeQuery()) {
                var list = new ArrayList<E>();
                while (rs.next()) {
                    list.add(fromResultSet(rs));
                }
                return list;
            }
        }
    }

    private StoreException storeError(String operation, SQLException e) {
        var error = new StoreException(operation, e);
        if (error.isQueryCanceled()) {
            LOG.warn("Failed to {}: statement canceled after {}s", operation, queryTimeoutSeconds);
        } else {
            LOG.error("Failed to {}: [{}] {}", operation, error.sqlState(), e.getMessage());
        }
        return error;
    }
}
