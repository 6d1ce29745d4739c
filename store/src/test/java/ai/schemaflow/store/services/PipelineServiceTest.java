package ai.schemaflow.store.services;

import ai.schemaflow.model.db.TransactionHandle;
import ai.schemaflow.model.db.exceptions.ConflictException;
import ai.schemaflow.model.db.exceptions.DaoException;
import ai.schemaflow.model.db.exceptions.InvalidTransitionException;
import ai.schemaflow.model.db.exceptions.NotFoundException;
import ai.schemaflow.model.db.exceptions.StaleVersionException;
import ai.schemaflow.model.db.exceptions.StoreException;
import ai.schemaflow.store.cache.GuavaEntityCache;
import ai.schemaflow.store.config.StoreConfig;
import ai.schemaflow.store.model.EntityKind;
import ai.schemaflow.store.model.Pipeline;
import ai.schemaflow.store.model.PipelineCreate;
import ai.schemaflow.store.model.PipelineFind;
import ai.schemaflow.store.model.PipelinePatch;
import ai.schemaflow.store.model.PipelineStatus;
import ai.schemaflow.store.test.RecordingEntityCache;
import ai.schemaflow.store.test.RecordingEntityCache.Upsert;
import ai.schemaflow.store.test.StoreTestBase;
import io.prometheus.client.CollectorRegistry;
import org.junit.Assert;
import org.junit.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class PipelineServiceTest extends StoreTestBase {

    private static final long ALICE = 101;
    private static final long BOB = 102;

    @Test
    public void createdPipelineIsOpen() throws DaoException {
        var pipeline = pipelines.create(new PipelineCreate(ALICE, "release-1"));

        Assert.assertTrue(pipeline.id() > 0);
        Assert.assertEquals("release-1", pipeline.name());
        Assert.assertEquals(PipelineStatus.OPEN, pipeline.status());
        Assert.assertEquals(ALICE, pipeline.creatorId());
        Assert.assertEquals(ALICE, pipeline.updaterId());
        Assert.assertEquals(1, pipeline.version());
        Assert.assertNotNull(pipeline.createdTs());
        Assert.assertNotNull(pipeline.updatedTs());
    }

    @Test
    public void findAfterCreateServedFromCache() throws DaoException {
        var created = pipelines.create(new PipelineCreate(ALICE, "release-1"));
        Assert.assertEquals(List.of(new Upsert(EntityKind.PIPELINE, created.id(), 1)), cache.upserts());

        storage.reset();
        var found = pipelines.find(PipelineFind.byId(created.id()));

        Assert.assertEquals(created, found);
        Assert.assertEquals(0, storage.connects());
        Assert.assertEquals(1, cache.hits());
    }

    @Test
    public void findWithExtraFiltersGoesToStore() throws DaoException {
        var created = pipelines.create(new PipelineCreate(ALICE, "release-1"));

        storage.reset();
        var found = pipelines.find(PipelineFind.builder().id(created.id()).status(PipelineStatus.DONE).build());

        Assert.assertNull(found);
        Assert.assertEquals(1, storage.connects());
        Assert.assertEquals(0, cache.hits());
    }

    @Test
    public void cacheMissPopulatesCache() throws DaoException {
        var created = pipelines.create(new PipelineCreate(ALICE, "release-1"));
        var config = context.getBean(StoreConfig.class);
        var coldCache = new RecordingEntityCache(new GuavaEntityCache(config, new CollectorRegistry()));
        var other = new PipelineService(storage, coldCache, config);

        storage.reset();
        Assert.assertEquals(created, other.find(PipelineFind.byId(created.id())));
        Assert.assertEquals(created, other.find(PipelineFind.byId(created.id())));
        Assert.assertEquals(1, storage.connects());
        Assert.assertEquals(1, coldCache.hits());
    }

    @Test
    public void absentEntityIsNull() throws DaoException {
        Assert.assertNull(pipelines.find(PipelineFind.byId(999)));
        Assert.assertNull(pipelines.find(PipelineFind.builder().status(PipelineStatus.CANCELED).build()));

        var e = Assert.assertThrows(NotFoundException.class, () -> pipelines.get(999));
        Assert.assertEquals(999, e.id());
    }

    @Test
    public void severalMatchesAreConflict() throws DaoException {
        pipelines.create(new PipelineCreate(ALICE, "release-1"));
        pipelines.create(new PipelineCreate(BOB, "release-2"));

        var e = Assert.assertThrows(ConflictException.class,
            () -> pipelines.find(PipelineFind.builder().status(PipelineStatus.OPEN).build()));
        Assert.assertEquals(1, e.expected());
        Assert.assertEquals(2, e.actual());
    }

    @Test
    public void patchOfAbsentIdIsNotFound() {
        cache.reset();
        storage.reset();

        var e = Assert.assertThrows(NotFoundException.class, () -> pipelines.patch(PipelinePatch.builder()
            .id(999)
            .updaterId(ALICE)
            .status(PipelineStatus.DONE)
            .build()));

        Assert.assertEquals(999, e.id());
        Assert.assertEquals(0, storage.updates());
        Assert.assertTrue(cache.upserts().isEmpty());
    }

    @Test
    public void terminalPipelineRejectsTransitionBeforeUpdate() throws DaoException {
        var pipeline = pipelines.create(new PipelineCreate(ALICE, "release-1"));
        pipelines.patch(PipelinePatch.builder().id(pipeline.id()).updaterId(ALICE).status(PipelineStatus.DONE).build());

        cache.reset();
        storage.reset();

        var e = Assert.assertThrows(InvalidTransitionException.class, () -> pipelines.patch(PipelinePatch.builder()
            .id(pipeline.id())
            .updaterId(BOB)
            .status(PipelineStatus.CANCELED)
            .build()));

        Assert.assertEquals(PipelineStatus.DONE, e.from());
        Assert.assertEquals(PipelineStatus.CANCELED, e.to());
        Assert.assertEquals(0, storage.updates());
        Assert.assertTrue(cache.upserts().isEmpty());
    }

    @Test
    public void patchUpdatesOnlyGivenFields() throws DaoException {
        var pipeline = pipelines.create(new PipelineCreate(ALICE, "release-1"));

        var renamed = pipelines.patch(PipelinePatch.builder().id(pipeline.id()).updaterId(BOB).name("release-1a").build());
        Assert.assertEquals("release-1a", renamed.name());
        Assert.assertEquals(PipelineStatus.OPEN, renamed.status());
        Assert.assertEquals(ALICE, renamed.creatorId());
        Assert.assertEquals(BOB, renamed.updaterId());
        Assert.assertEquals(2, renamed.version());
        Assert.assertEquals(pipeline.createdTs(), renamed.createdTs());

        // same status is not a transition
        var same = pipelines.patch(PipelinePatch.builder()
            .id(pipeline.id())
            .updaterId(BOB)
            .status(PipelineStatus.OPEN)
            .build());
        Assert.assertEquals(PipelineStatus.OPEN, same.status());
        Assert.assertEquals(3, same.version());

        Assert.assertEquals(same, pipelines.get(pipeline.id()));
    }

    @Test
    public void staleVersionRejected() throws DaoException {
        var pipeline = pipelines.create(new PipelineCreate(ALICE, "release-1"));
        pipelines.patch(PipelinePatch.builder().id(pipeline.id()).updaterId(BOB).name("by bob").build());

        var e = Assert.assertThrows(StaleVersionException.class, () -> pipelines.patch(PipelinePatch.builder()
            .id(pipeline.id())
            .updaterId(ALICE)
            .name("by alice")
            .expectedVersion(pipeline.version())
            .build()));
        Assert.assertEquals(1, e.expected());
        Assert.assertEquals(2, e.actual());

        var patched = pipelines.patch(PipelinePatch.builder()
            .id(pipeline.id())
            .updaterId(ALICE)
            .name("by alice")
            .expectedVersion(2L)
            .build());
        Assert.assertEquals("by alice", patched.name());
    }

    @Test
    public void findListAlwaysReadsStore() throws DaoException, SQLException {
        var first = pipelines.create(new PipelineCreate(ALICE, "release-1"));
        var second = pipelines.create(new PipelineCreate(BOB, "release-2"));

        // change a row behind the service's back
        try (var con = storage.delegate().connect();
             var st = con.prepareStatement("UPDATE pipeline SET name = 'renamed' WHERE id = ?"))
        {
            st.setLong(1, first.id());
            st.executeUpdate();
        }

        storage.reset();
        var list = pipelines.findList(PipelineFind.builder().build());

        Assert.assertEquals(1, storage.connects());
        Assert.assertEquals(List.of(first.id(), second.id()), list.stream().map(Pipeline::id).toList());
        Assert.assertEquals("renamed", list.get(0).name());

        var open = pipelines.findList(PipelineFind.builder().status(PipelineStatus.OPEN).build());
        Assert.assertEquals(2, open.size());
        Assert.assertTrue(pipelines.findList(PipelineFind.builder().status(PipelineStatus.DONE).build()).isEmpty());
    }

    @Test
    public void callerTransactionDefersCacheWrites() throws DaoException, SQLException {
        Pipeline created;
        try (var tx = TransactionHandle.create(storage)) {
            created = pipelines.create(new PipelineCreate(ALICE, "release-1"), tx);
            pipelines.patch(PipelinePatch.builder().id(created.id()).updaterId(ALICE).name("release-1a").build(), tx);

            Assert.assertTrue(cache.upserts().isEmpty());

            // the caller's transaction sees its own uncommitted rows
            Assert.assertEquals("release-1a", pipelines.get(created.id(), tx).name());

            tx.commit();
        }

        Assert.assertFalse(cache.upserts().isEmpty());

        storage.reset();
        var found = pipelines.get(created.id());
        Assert.assertEquals("release-1a", found.name());
        Assert.assertEquals(2, found.version());
        Assert.assertEquals(0, storage.connects());
    }

    @Test
    public void rolledBackTransactionLeavesNoTrace() throws DaoException, SQLException {
        long id;
        try (var tx = TransactionHandle.create(storage)) {
            id = pipelines.create(new PipelineCreate(ALICE, "release-1"), tx).id();
        }

        Assert.assertTrue(cache.upserts().isEmpty());
        Assert.assertNull(pipelines.find(PipelineFind.byId(id)));
    }

    @Test
    public void releaseScenario() throws DaoException {
        var pipeline = pipelines.create(new PipelineCreate(ALICE, "release-42"));
        Assert.assertEquals(PipelineStatus.OPEN, pipeline.status());

        var done = pipelines.patch(PipelinePatch.builder()
            .id(pipeline.id())
            .updaterId(BOB)
            .status(PipelineStatus.DONE)
            .build());
        Assert.assertEquals(PipelineStatus.DONE, done.status());

        Assert.assertThrows(InvalidTransitionException.class, () -> pipelines.patch(PipelinePatch.builder()
            .id(pipeline.id())
            .updaterId(BOB)
            .status(PipelineStatus.OPEN)
            .build()));

        var found = pipelines.find(PipelineFind.byId(pipeline.id()));
        Assert.assertNotNull(found);
        Assert.assertEquals(PipelineStatus.DONE, found.status());
        Assert.assertEquals("release-42", found.name());
    }

    @Test
    public void missingNameIsStoreError() {
        cache.reset();

        var e = Assert.assertThrows(StoreException.class, () -> pipelines.create(new PipelineCreate(ALICE, null)));

        Assert.assertEquals("create " + EntityKind.PIPELINE, e.operation());
        Assert.assertTrue(cache.upserts().isEmpty());
    }

    @Test
    public void failedCacheWriteDropsOldSnapshot() throws DaoException {
        var pipeline = pipelines.create(new PipelineCreate(ALICE, "release-1"));

        cache.failUpserts(true);
        var renamed = pipelines.patch(PipelinePatch.builder()
            .id(pipeline.id())
            .updaterId(BOB)
            .name("release-1a")
            .build());
        Assert.assertEquals(List.of(pipeline.id()), cache.invalidated());

        cache.failUpserts(false);
        storage.reset();
        Assert.assertEquals(renamed, pipelines.get(pipeline.id()));
        Assert.assertEquals(1, storage.connects());
    }

    @Test
    public void concurrentPatchesAreSerialized() throws Exception {
        final int threads = 4;
        final int patchesPerThread = 10;
        var pipeline = pipelines.create(new PipelineCreate(ALICE, "release-1"));

        var executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < threads; i++) {
                final long updater = 1000 + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < patchesPerThread; j++) {
                        pipelines.patch(PipelinePatch.builder()
                            .id(pipeline.id())
                            .updaterId(updater)
                            .name("release-%d-%d".formatted(updater, j))
                            .build());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var future : futures) {
                future.get(20, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        var stored = pipelines.findList(PipelineFind.byId(pipeline.id())).get(0);
        Assert.assertEquals(1 + threads * patchesPerThread, stored.version());

        storage.reset();
        Assert.assertEquals(stored, pipelines.find(PipelineFind.byId(pipeline.id())));
        Assert.assertEquals(0, storage.connects());
    }
}
