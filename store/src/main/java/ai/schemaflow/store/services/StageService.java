package ai.schemaflow.store.services;

import ai.schemaflow.model.db.DbHelper;
import ai.schemaflow.model.db.Storage;
import ai.schemaflow.model.db.TransactionHandle;
import ai.schemaflow.model.db.exceptions.DaoException;
import ai.schemaflow.model.db.exceptions.InvalidTransitionException;
import ai.schemaflow.model.db.exceptions.StoreException;
import ai.schemaflow.model.db.sql.ClauseBuilder;
import ai.schemaflow.store.cache.EntityCache;
import ai.schemaflow.store.config.StoreConfig;
import ai.schemaflow.store.model.EntityKind;
import ai.schemaflow.store.model.Stage;
import ai.schemaflow.store.model.StageCreate;
import ai.schemaflow.store.model.StageFind;
import ai.schemaflow.store.model.StagePatch;
import ai.schemaflow.store.model.StageStatus;
import ai.schemaflow.store.model.TaskStatus;
import ai.schemaflow.store.statemachine.Lifecycles;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stages keep contiguous ordinals within their pipeline. Their status follows the statuses of their tasks and
 * can only be set directly while no task has started.
 */
@Singleton
public class StageService extends EntityService<StageStatus, Stage, StageCreate, StageFind, StagePatch> {
    private static final Logger LOG = LogManager.getLogger(StageService.class);

    private static final String QUERY_LOCK_PIPELINE = """
        SELECT id
        FROM pipeline
        WHERE id = ?
        FOR UPDATE""";

    private static final String QUERY_COUNT_STAGES = """
        SELECT COUNT(*)
        FROM stage
        WHERE pipeline_id = ?""";

    private static final String QUERY_TASK_STATUSES = """
        SELECT status
        FROM task
        WHERE stage_id = ?""";

    private static final String QUERY_SET_DERIVED_STATUS = """
        UPDATE stage
        SET status = ?, updater_id = ?, updated_ts = CURRENT_TIMESTAMP, version = version + 1
        WHERE id = ?""";

    public StageService(Storage storage, EntityCache cache, StoreConfig config) {
        super(EntityKind.STAGE, Stage.class, Lifecycles.STAGE,
            List.of("pipeline_id", "environment_id", "ordinal", "name"), storage, cache, config);
    }

    @Override
    protected StageStatus initialStatus() {
        return StageStatus.PENDING;
    }

    @Override
    protected StageFind findById(long id) {
        return StageFind.byId(id);
    }

    @Override
    protected Map<String, Object> insertValues(Connection con, StageCreate create)
        throws SQLException, DaoException
    {
        // Serializes concurrent appends to the same pipeline.
        try (var st = prepare(con, QUERY_LOCK_PIPELINE)) {
            st.setLong(1, create.pipelineId());
            st.executeQuery().close();
        }

        int next;
        try (var st = prepare(con, QUERY_COUNT_STAGES)) {
            st.setLong(1, create.pipelineId());
            try (var rs = st.executeQuery()) {
                rs.next();
                next = rs.getInt(1);
            }
        }

        var ordinal = create.ordinal();
        if (ordinal == null) {
            ordinal = next;
        } else if (ordinal < 0 || ordinal > next) {
            throw new StoreException("create stage",
                "ordinal %d is not contiguous in pipeline %d, next ordinal is %d"
                    .formatted(ordinal, create.pipelineId(), next));
        }

        var values = new LinkedHashMap<String, Object>();
        values.put("pipeline_id", create.pipelineId());
        values.put("environment_id", create.environmentId());
        values.put("ordinal", ordinal);
        values.put("name", create.name());
        return values;
    }

    @Override
    protected void appendFilters(StageFind find, ClauseBuilder where) {
        where
            .add("pipeline_id", find.pipelineId())
            .add("environment_id", find.environmentId())
            .add("ordinal", find.ordinal())
            .add("status", find.status());
    }

    @Override
    protected void appendAssignments(StagePatch patch, ClauseBuilder set) {
        set.add("name", patch.name());
    }

    @Override
    protected void validateTransition(Connection con, Stage current, StageStatus to)
        throws SQLException, DaoException
    {
        var started = taskStatuses(con, current.id()).stream().anyMatch(s -> s != TaskStatus.PENDING);
        if (started) {
            throw new InvalidTransitionException(kind.table(), current.id(), current.status(), to,
                "status is derived from tasks once any task has started");
        }
        super.validateTransition(con, current, to);
    }

    @Override
    protected Stage fromResultSet(ResultSet rs) throws SQLException {
        return new Stage(
            rs.getLong("id"),
            rs.getLong("creator_id"),
            DbHelper.getInstant(rs, "created_ts"),
            rs.getLong("updater_id"),
            DbHelper.getInstant(rs, "updated_ts"),
            rs.getLong("version"),
            rs.getLong("pipeline_id"),
            rs.getLong("environment_id"),
            rs.getInt("ordinal"),
            rs.getString("name"),
            StageStatus.valueOf(rs.getString("status")));
    }

    /**
     * Recomputes the stage status from its tasks inside the given transaction. A stage canceled by hand stays
     * canceled.
     *
     * @return the stage after the update
     */
    Stage refreshStatus(TransactionHandle tx, long stageId, long updaterId) throws SQLException {
        var con = tx.connect();

        var stage = selectOne(con, stageId, true);
        if (stage == null) {
            throw new SQLException("Stage %d disappeared while refreshing its status".formatted(stageId));
        }
        if (stage.status() == StageStatus.CANCELED) {
            return stage;
        }

        var derived = Lifecycles.stageStatusOf(taskStatuses(con, stageId));
        if (derived == stage.status()) {
            return stage;
        }

        try (var st = prepare(con, QUERY_SET_DERIVED_STATUS)) {
            st.setString(1, derived.name());
            st.setLong(2, updaterId);
            st.setLong(3, stageId);
            st.executeUpdate();
        }

        var updated = selectOne(con, stageId, false);
        LOG.info("Stage {} status {} -> {} following its tasks", stageId, stage.status(), derived);

        cacheOnCommit(tx, updated);
        return updated;
    }

    private List<TaskStatus> taskStatuses(Connection con, long stageId) throws SQLException {
        try (var st = prepare(con, QUERY_TASK_STATUSES)) {
            st.setLong(1, stageId);
            try (var rs = st.executeQuery()) {
                var list = new ArrayList<TaskStatus>();
                while (rs.next()) {
                    list.add(TaskStatus.valueOf(rs.getString("status")));
                }
                return list;
            }
        }
    }
}
