package ai.schemaflow.store.statemachine;

import ai.schemaflow.store.model.IssueStatus;
import ai.schemaflow.store.model.PipelineStatus;
import ai.schemaflow.store.model.StageStatus;
import ai.schemaflow.store.model.TaskStatus;

import java.util.Collection;

import static ai.schemaflow.store.model.TaskStatus.CANCELED;
import static ai.schemaflow.store.model.TaskStatus.DONE;
import static ai.schemaflow.store.model.TaskStatus.FAILED;
import static ai.schemaflow.store.model.TaskStatus.PENDING;
import static ai.schemaflow.store.model.TaskStatus.RUNNING;

public enum Lifecycles {
    ;

    public static final TransitionTable<PipelineStatus> PIPELINE = TransitionTable.builder(PipelineStatus.class)
        .allow(PipelineStatus.OPEN, PipelineStatus.DONE, PipelineStatus.CANCELED)
        .build();

    public static final TransitionTable<TaskStatus> TASK = TransitionTable.builder(TaskStatus.class)
        .allow(PENDING, RUNNING, CANCELED)
        .allow(RUNNING, DONE, FAILED, CANCELED)
        .build();

    public static final TransitionTable<StageStatus> STAGE = TransitionTable.builder(StageStatus.class)
        .allow(StageStatus.PENDING, StageStatus.RUNNING, StageStatus.CANCELED)
        .allow(StageStatus.RUNNING, StageStatus.DONE, StageStatus.FAILED, StageStatus.CANCELED)
        .build();

    public static final TransitionTable<IssueStatus> ISSUE = TransitionTable.builder(IssueStatus.class)
        .allow(IssueStatus.OPEN, IssueStatus.DONE, IssueStatus.CANCELED)
        .allow(IssueStatus.DONE, IssueStatus.OPEN)
        .allow(IssueStatus.CANCELED, IssueStatus.OPEN)
        .build();

    /**
     * Stage status as seen through its tasks.
     */
    public static StageStatus stageStatusOf(Collection<TaskStatus> tasks) {
        if (tasks.isEmpty() || tasks.stream().allMatch(s -> s == PENDING)) {
            return StageStatus.PENDING;
        }
        if (tasks.contains(FAILED)) {
            return StageStatus.FAILED;
        }
        if (tasks.contains(RUNNING)) {
            return StageStatus.RUNNING;
        }
        if (tasks.stream().allMatch(s -> s == CANCELED)) {
            return StageStatus.CANCELED;
        }
        if (tasks.stream().allMatch(s -> s == DONE || s == CANCELED)) {
            return StageStatus.DONE;
        }
        return StageStatus.RUNNING;
    }
}
