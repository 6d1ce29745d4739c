package ai.schemaflow.store.statemachine;

import ai.schemaflow.model.db.exceptions.InvalidTransitionException;
import ai.schemaflow.store.model.IssueStatus;
import ai.schemaflow.store.model.PipelineStatus;
import ai.schemaflow.store.model.StageStatus;
import ai.schemaflow.store.model.TaskStatus;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static ai.schemaflow.store.model.TaskStatus.CANCELED;
import static ai.schemaflow.store.model.TaskStatus.DONE;
import static ai.schemaflow.store.model.TaskStatus.FAILED;
import static ai.schemaflow.store.model.TaskStatus.PENDING;
import static ai.schemaflow.store.model.TaskStatus.RUNNING;

public class LifecyclesTest {

    @Test
    public void pipeline() {
        var table = Lifecycles.PIPELINE;

        Assert.assertEquals(Set.of(PipelineStatus.DONE, PipelineStatus.CANCELED), table.next(PipelineStatus.OPEN));
        Assert.assertTrue(table.isTerminal(PipelineStatus.DONE));
        Assert.assertTrue(table.isTerminal(PipelineStatus.CANCELED));
        Assert.assertFalse(table.isAllowed(PipelineStatus.DONE, PipelineStatus.OPEN));
        Assert.assertFalse(table.isAllowed(PipelineStatus.CANCELED, PipelineStatus.DONE));
        Assert.assertTrue(table.isAllowed(PipelineStatus.DONE, PipelineStatus.DONE));
    }

    @Test
    public void task() {
        var table = Lifecycles.TASK;

        Assert.assertEquals(Set.of(RUNNING, CANCELED), table.next(PENDING));
        Assert.assertEquals(Set.of(DONE, FAILED, CANCELED), table.next(RUNNING));
        for (var terminal : List.of(DONE, FAILED, CANCELED)) {
            Assert.assertTrue(table.isTerminal(terminal));
        }
        Assert.assertFalse(table.isAllowed(PENDING, DONE));
        Assert.assertFalse(table.isAllowed(FAILED, RUNNING));
    }

    @Test
    public void issueCanBeReopened() {
        Assert.assertTrue(Lifecycles.ISSUE.isAllowed(IssueStatus.DONE, IssueStatus.OPEN));
        Assert.assertTrue(Lifecycles.ISSUE.isAllowed(IssueStatus.CANCELED, IssueStatus.OPEN));
        Assert.assertFalse(Lifecycles.ISSUE.isAllowed(IssueStatus.CANCELED, IssueStatus.DONE));
        Assert.assertFalse(Lifecycles.ISSUE.isTerminal(IssueStatus.DONE));
    }

    @Test
    public void checkNamesTheEdge() {
        var e = Assert.assertThrows(InvalidTransitionException.class,
            () -> Lifecycles.PIPELINE.check("pipeline", 42, PipelineStatus.DONE, PipelineStatus.OPEN));

        Assert.assertEquals(42, e.id());
        Assert.assertEquals(PipelineStatus.DONE, e.from());
        Assert.assertEquals(PipelineStatus.OPEN, e.to());
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("DONE is a terminal state"));

        var notAllowed = Assert.assertThrows(InvalidTransitionException.class,
            () -> Lifecycles.TASK.check("task", 1, PENDING, DONE));
        Assert.assertTrue(notAllowed.getMessage(), notAllowed.getMessage().contains("not allowed"));
    }

    @Test
    public void stageStatusOfTasks() {
        Assert.assertEquals(StageStatus.PENDING, Lifecycles.stageStatusOf(List.of()));
        Assert.assertEquals(StageStatus.PENDING, Lifecycles.stageStatusOf(List.of(PENDING, PENDING)));
        Assert.assertEquals(StageStatus.RUNNING, Lifecycles.stageStatusOf(List.of(PENDING, RUNNING)));
        Assert.assertEquals(StageStatus.RUNNING, Lifecycles.stageStatusOf(List.of(DONE, PENDING)));
        Assert.assertEquals(StageStatus.FAILED, Lifecycles.stageStatusOf(List.of(RUNNING, FAILED, DONE)));
        Assert.assertEquals(StageStatus.CANCELED, Lifecycles.stageStatusOf(List.of(CANCELED, CANCELED)));
        Assert.assertEquals(StageStatus.DONE, Lifecycles.stageStatusOf(List.of(DONE, CANCELED)));
        Assert.assertEquals(StageStatus.DONE, Lifecycles.stageStatusOf(List.of(DONE)));
        Assert.assertEquals(StageStatus.RUNNING, Lifecycles.stageStatusOf(List.of(CANCELED, PENDING)));
    }

    @Test
    public void stageTableMirrorsTaskTable() {
        for (var from : TaskStatus.values()) {
            for (var to : TaskStatus.values()) {
                Assert.assertEquals(from + " -> " + to,
                    Lifecycles.TASK.isAllowed(from, to),
                    Lifecycles.STAGE.isAllowed(StageStatus.valueOf(from.name()), StageStatus.valueOf(to.name())));
            }
        }
    }
}
