package ai.schemaflow.store.services;

import ai.schemaflow.model.db.Storage;
import ai.schemaflow.model.db.TransactionHandle;
import ai.schemaflow.model.db.exceptions.DaoException;
import ai.schemaflow.model.db.exceptions.StoreException;
import ai.schemaflow.store.model.Pipeline;
import ai.schemaflow.store.model.PipelineCreate;
import ai.schemaflow.store.model.PipelinePatch;
import ai.schemaflow.store.model.PipelineStatus;
import ai.schemaflow.store.model.Stage;
import ai.schemaflow.store.model.StageCreate;
import ai.schemaflow.store.model.StageFind;
import ai.schemaflow.store.model.Task;
import ai.schemaflow.store.model.TaskCreate;
import ai.schemaflow.store.model.TaskFind;
import ai.schemaflow.store.model.TaskPatch;
import ai.schemaflow.store.model.TaskPayload;
import ai.schemaflow.store.model.TaskStatus;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-entity operations that must succeed or fail as a whole. Each one runs in a single transaction, so a
 * failure at any step leaves neither rows nor cache entries behind.
 */
@Singleton
public class PipelineComposer {
    private static final Logger LOG = LogManager.getLogger(PipelineComposer.class);

    private final Storage storage;
    private final PipelineService pipelines;
    private final StageService stages;
    private final TaskService tasks;

    public PipelineComposer(Storage storage, PipelineService pipelines, StageService stages, TaskService tasks) {
        this.storage = storage;
        this.pipelines = pipelines;
        this.stages = stages;
        this.tasks = tasks;
    }

    public record TaskPlan(String name, String type, @Nullable Long databaseId, TaskPayload payload) {}

    public record StagePlan(String name, long environmentId, List<TaskPlan> tasks) {}

    public record ComposedPipeline(Pipeline pipeline, List<Stage> stages, List<Task> tasks) {}

    /**
     * Creates the pipeline, its stages in the given order and their tasks.
     */
    public ComposedPipeline createPipeline(long creatorId, String name, List<StagePlan> plan) throws DaoException {
        LOG.info("Compose pipeline {} with {} stages", name, plan.size());

        try (var tx = TransactionHandle.create(storage)) {
            var pipeline = pipelines.create(new PipelineCreate(creatorId, name), tx);

            var createdTasks = new ArrayList<Task>();
            var stageIds = new ArrayList<Long>();
            for (var stagePlan : plan) {
                var stage = stages.create(
                    new StageCreate(creatorId, pipeline.id(), stagePlan.environmentId(), stagePlan.name(), null), tx);
                stageIds.add(stage.id());

                for (var taskPlan : stagePlan.tasks()) {
                    createdTasks.add(tasks.create(new TaskCreate(creatorId, stage.id(), taskPlan.databaseId(),
                        taskPlan.name(), taskPlan.type(), taskPlan.payload()), tx));
                }
            }

            // Task creation may have moved stage statuses, so read the final snapshots.
            var createdStages = new ArrayList<Stage>();
            for (var stageId : stageIds) {
                createdStages.add(stages.get(stageId, tx));
            }

            tx.commit();

            LOG.info("Composed pipeline {}: {} stages, {} tasks", pipeline.id(), createdStages.size(),
                createdTasks.size());
            return new ComposedPipeline(pipeline, createdStages, createdTasks);
        } catch (SQLException e) {
            throw new StoreException("compose pipeline " + name, e);
        }
    }

    /**
     * Cancels the pipeline together with every task that has not finished yet.
     */
    public Pipeline cancelPipeline(long pipelineId, long updaterId) throws DaoException {
        LOG.info("Cancel pipeline {}", pipelineId);

        try (var tx = TransactionHandle.create(storage)) {
            var pipeline = pipelines.patch(PipelinePatch.builder()
                .id(pipelineId)
                .updaterId(updaterId)
                .status(PipelineStatus.CANCELED)
                .build(), tx);

            var unfinishedFind = TaskFind.builder()
                .pipelineId(pipelineId)
                .statusList(List.of(TaskStatus.PENDING, TaskStatus.RUNNING))
                .build();

            // Task rows first, then stage rows, each in id order: the same order a single task patch takes them.
            tasks.lockForUpdate(tasks.findList(unfinishedFind, tx).stream().map(Task::id).toList(), tx);
            stages.lockForUpdate(stages.findList(StageFind.byPipeline(pipelineId), tx).stream()
                .map(Stage::id)
                .toList(), tx);

            // Tasks may have moved on while this transaction was waiting for their locks.
            var unfinished = tasks.findList(unfinishedFind, tx);
            for (var task : unfinished) {
                tasks.patch(TaskPatch.builder()
                    .id(task.id())
                    .updaterId(updaterId)
                    .status(TaskStatus.CANCELED)
                    .build(), tx);
            }

            tx.commit();

            LOG.info("Canceled pipeline {} and {} unfinished tasks", pipelineId, unfinished.size());
            return pipeline;
        } catch (SQLException e) {
            throw new StoreException("cancel pipeline " + pipelineId, e);
        }
    }
}
