package ai.schemaflow.store.services;

import ai.schemaflow.model.db.DbHelper;
import ai.schemaflow.model.db.Storage;
import ai.schemaflow.model.db.sql.ClauseBuilder;
import ai.schemaflow.store.cache.EntityCache;
import ai.schemaflow.store.config.StoreConfig;
import ai.schemaflow.store.model.EntityKind;
import ai.schemaflow.store.model.Issue;
import ai.schemaflow.store.model.IssueCreate;
import ai.schemaflow.store.model.IssueFind;
import ai.schemaflow.store.model.IssuePatch;
import ai.schemaflow.store.model.IssueStatus;
import ai.schemaflow.store.statemachine.Lifecycles;
import jakarta.inject.Singleton;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issues follow the pipeline lifecycle but can be reopened once resolved.
 */
@Singleton
public class IssueService extends EntityService<IssueStatus, Issue, IssueCreate, IssueFind, IssuePatch> {

    public IssueService(Storage storage, EntityCache cache, StoreConfig config) {
        super(EntityKind.ISSUE, Issue.class, Lifecycles.ISSUE,
            List.of("project_id", "pipeline_id", "name", "type", "description", "assignee_id"),
            storage, cache, config);
    }

    @Override
    protected IssueStatus initialStatus() {
        return IssueStatus.OPEN;
    }

    @Override
    protected IssueFind findById(long id) {
        return IssueFind.byId(id);
    }

    @Override
    protected Map<String, Object> insertValues(Connection con, IssueCreate create) {
        var values = new LinkedHashMap<String, Object>();
        values.put("project_id", create.projectId());
        values.put("pipeline_id", create.pipelineId());
        values.put("name", create.name());
        values.put("type", create.type());
        values.put("description", create.description());
        values.put("assignee_id", create.assigneeId());
        return values;
    }

    @Override
    protected void appendFilters(IssueFind find, ClauseBuilder where) {
        where
            .add("project_id", find.projectId())
            .add("pipeline_id", find.pipelineId())
            .add("assignee_id", find.assigneeId())
            .add("status", find.status());
    }

    @Override
    protected void appendAssignments(IssuePatch patch, ClauseBuilder set) {
        set
            .add("name", patch.name())
            .add("description", patch.description())
            .add("assignee_id", patch.assigneeId());
    }

    @Override
    protected Issue fromResultSet(ResultSet rs) throws SQLException {
        return new Issue(
            rs.getLong("id"),
            rs.getLong("creator_id"),
            DbHelper.getInstant(rs, "created_ts"),
            rs.getLong("updater_id"),
            DbHelper.getInstant(rs, "updated_ts"),
            rs.getLong("version"),
            rs.getLong("project_id"),
            DbHelper.getNullableLong(rs, "pipeline_id"),
            rs.getString("name"),
            rs.getString("type"),
            rs.getString("description"),
            DbHelper.getNullableLong(rs, "assignee_id"),
            IssueStatus.valueOf(rs.getString("status")));
    }
}
