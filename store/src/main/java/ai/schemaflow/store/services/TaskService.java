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
import ai.schemaflow.store.model.PipelineStatus;
import ai.schemaflow.store.model.StageStatus;
import ai.schemaflow.store.model.Task;
import ai.schemaflow.store.model.TaskCreate;
import ai.schemaflow.store.model.TaskFind;
import ai.schemaflow.store.model.TaskPatch;
import ai.schemaflow.store.model.TaskPayload;
import ai.schemaflow.store.model.TaskResult;
import ai.schemaflow.store.model.TaskStatus;
import ai.schemaflow.store.statemachine.Lifecycles;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Singleton
public class TaskService extends EntityService<TaskStatus, Task, TaskCreate, TaskFind, TaskPatch> {

    private static final String QUERY_LOCK_STAGE = """
        SELECT pipeline_id, status
        FROM stage
        WHERE id = ?
        FOR UPDATE""";

    private static final String QUERY_TASK_OWNERS = """
        SELECT s.status AS stage_status, p.status AS pipeline_status
        FROM stage s
        JOIN pipeline p ON p.id = s.pipeline_id
        WHERE s.id = ?""";

    private final StageService stageService;
    private final ObjectMapper objectMapper;

    public TaskService(Storage storage, EntityCache cache, StoreConfig config, StageService stageService,
                       @Named("StoreObjectMapper") ObjectMapper objectMapper)
    {
        super(EntityKind.TASK, Task.class, Lifecycles.TASK,
            List.of("pipeline_id", "stage_id", "database_id", "name", "type", "payload", "result"),
            storage, cache, config);
        this.stageService = stageService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected TaskStatus initialStatus() {
        return TaskStatus.PENDING;
    }

    @Override
    protected TaskFind findById(long id) {
        return TaskFind.byId(id);
    }

    @Override
    protected Map<String, Object> insertValues(Connection con, TaskCreate create)
        throws SQLException, DaoException
    {
        long pipelineId;
        try (var st = prepare(con, QUERY_LOCK_STAGE)) {
            st.setLong(1, create.stageId());
            try (var rs = st.executeQuery()) {
                if (!rs.next()) {
                    throw new StoreException("create task", "stage %d does not exist".formatted(create.stageId()));
                }
                var stageStatus = StageStatus.valueOf(rs.getString("status"));
                if (Lifecycles.STAGE.isTerminal(stageStatus)) {
                    throw new StoreException("create task",
                        "stage %d is %s and accepts no new tasks".formatted(create.stageId(), stageStatus));
                }
                pipelineId = rs.getLong("pipeline_id");
            }
        }

        var values = new LinkedHashMap<String, Object>();
        values.put("pipeline_id", pipelineId);
        values.put("stage_id", create.stageId());
        values.put("database_id", create.databaseId());
        values.put("name", create.name());
        values.put("type", create.type());
        values.put("payload", toJson(create.payload()));
        return values;
    }

    @Override
    protected void appendFilters(TaskFind find, ClauseBuilder where) {
        where
            .add("pipeline_id", find.pipelineId())
            .add("stage_id", find.stageId())
            .add("database_id", find.databaseId())
            .addIn("status", find.statusList());
    }

    @Override
    protected void appendAssignments(TaskPatch patch, ClauseBuilder set) throws SQLException {
        if (patch.payload() != null) {
            set.add("payload", toJson(patch.payload()));
        }
        if (patch.result() != null) {
            set.add("result", toJson(patch.result()));
        }
    }

    @Override
    protected void validateTransition(Connection con, Task current, TaskStatus to)
        throws SQLException, DaoException
    {
        super.validateTransition(con, current, to);
        if (to != TaskStatus.RUNNING) {
            return;
        }

        try (var st = prepare(con, QUERY_TASK_OWNERS)) {
            st.setLong(1, current.stageId());
            try (var rs = st.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Stage %d of task %d not found".formatted(current.stageId(), current.id()));
                }
                var pipelineStatus = PipelineStatus.valueOf(rs.getString("pipeline_status"));
                if (pipelineStatus != PipelineStatus.OPEN) {
                    throw new InvalidTransitionException(kind.table(), current.id(), current.status(), to,
                        "pipeline %d is %s".formatted(current.pipelineId(), pipelineStatus));
                }
                var stageStatus = StageStatus.valueOf(rs.getString("stage_status"));
                if (Lifecycles.STAGE.isTerminal(stageStatus)) {
                    throw new InvalidTransitionException(kind.table(), current.id(), current.status(), to,
                        "stage %d is %s".formatted(current.stageId(), stageStatus));
                }
            }
        }
    }

    @Override
    protected void afterCreate(TransactionHandle tx, Task created) throws SQLException {
        stageService.refreshStatus(tx, created.stageId(), created.creatorId());
    }

    @Override
    protected void afterPatch(TransactionHandle tx, Task before, Task after) throws SQLException {
        if (before.status() != after.status()) {
            stageService.refreshStatus(tx, after.stageId(), after.updaterId());
        }
    }

    @Override
    protected Task fromResultSet(ResultSet rs) throws SQLException {
        return new Task(
            rs.getLong("id"),
            rs.getLong("creator_id"),
            DbHelper.getInstant(rs, "created_ts"),
            rs.getLong("updater_id"),
            DbHelper.getInstant(rs, "updated_ts"),
            rs.getLong("version"),
            rs.getLong("pipeline_id"),
            rs.getLong("stage_id"),
            DbHelper.getNullableLong(rs, "database_id"),
            rs.getString("name"),
            rs.getString("type"),
            TaskStatus.valueOf(rs.getString("status")),
            fromJson(rs.getString("payload"), TaskPayload.class),
            fromJson(rs.getString("result"), TaskResult.class));
    }

    private String toJson(Object value) throws SQLException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    @Nullable
    private <T> T fromJson(@Nullable String json, Class<T> type) throws SQLException {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot parse " + type.getSimpleName(), e);
        }
    }
}
