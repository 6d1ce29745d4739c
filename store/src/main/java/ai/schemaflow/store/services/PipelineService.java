package ai.schemaflow.store.services;

import ai.schemaflow.model.db.DbHelper;
import ai.schemaflow.model.db.Storage;
import ai.schemaflow.model.db.sql.ClauseBuilder;
import ai.schemaflow.store.cache.EntityCache;
import ai.schemaflow.store.config.StoreConfig;
import ai.schemaflow.store.model.EntityKind;
import ai.schemaflow.store.model.Pipeline;
import ai.schemaflow.store.model.PipelineCreate;
import ai.schemaflow.store.model.PipelineFind;
import ai.schemaflow.store.model.PipelinePatch;
import ai.schemaflow.store.model.PipelineStatus;
import ai.schemaflow.store.statemachine.Lifecycles;
import jakarta.inject.Singleton;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipelines are created OPEN and may only move to DONE or CANCELED.
 */
@Singleton
public class PipelineService
    extends EntityService<PipelineStatus, Pipeline, PipelineCreate, PipelineFind, PipelinePatch>
{
    public PipelineService(Storage storage, EntityCache cache, StoreConfig config) {
        super(EntityKind.PIPELINE, Pipeline.class, Lifecycles.PIPELINE, List.of("name"), storage, cache, config);
    }

    @Override
    protected PipelineStatus initialStatus() {
        return PipelineStatus.OPEN;
    }

    @Override
    protected PipelineFind findById(long id) {
        return PipelineFind.byId(id);
    }

    @Override
    protected Map<String, Object> insertValues(Connection con, PipelineCreate create) {
        var values = new LinkedHashMap<String, Object>();
        values.put("name", create.name());
        return values;
    }

    @Override
    protected void appendFilters(PipelineFind find, ClauseBuilder where) {
        where.add("status", find.status());
    }

    @Override
    protected void appendAssignments(PipelinePatch patch, ClauseBuilder set) {
        set.add("name", patch.name());
    }

    @Override
    protected Pipeline fromResultSet(ResultSet rs) throws SQLException {
        return new Pipeline(
            rs.getLong("id"),
            rs.getLong("creator_id"),
            DbHelper.getInstant(rs, "created_ts"),
            rs.getLong("updater_id"),
            DbHelper.getInstant(rs, "updated_ts"),
            rs.getLong("version"),
            rs.getString("name"),
            PipelineStatus.valueOf(rs.getString("status")));
    }
}
