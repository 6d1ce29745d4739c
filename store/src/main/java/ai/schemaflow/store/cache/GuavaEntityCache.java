package ai.schemaflow.store.cache;

import ai.schemaflow.store.config.StoreConfig;
import ai.schemaflow.store.model.EntityKind;
import ai.schemaflow.store.model.RawEntity;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

@Singleton
public class GuavaEntityCache implements EntityCache {
    private static final Logger LOG = LogManager.getLogger(GuavaEntityCache.class);

    private final Cache<CacheKey, RawEntity<?>> entries;
    private final Counter lookups;
    private final Counter writes;

    public GuavaEntityCache(StoreConfig config, @Named("StoreMetricsRegistry") CollectorRegistry registry) {
        this.entries = CacheBuilder.newBuilder()
            .maximumSize(config.getCache().getMaximumSize())
            .concurrencyLevel(config.getCache().getConcurrencyLevel())
            .build();

        this.lookups = Counter
            .build("entity_cache_lookups", "Entity cache point lookups")
            .subsystem("store")
            .labelNames("kind", "result")
            .register(registry);
        this.writes = Counter
            .build("entity_cache_writes", "Entity cache upserts")
            .subsystem("store")
            .labelNames("kind", "result")
            .register(registry);
    }

    @Override
    public <E extends RawEntity<?>> Optional<E> find(EntityKind kind, long id, Class<E> type) {
        var entity = entries.getIfPresent(new CacheKey(kind, id));
        if (entity == null) {
            lookups.labels(kind.table(), "miss").inc();
            return Optional.empty();
        }
        lookups.labels(kind.table(), "hit").inc();
        return Optional.of(type.cast(entity));
    }

    @Override
    public void upsert(EntityKind kind, long id, RawEntity<?> entity) {
        entries.asMap().compute(new CacheKey(kind, id), (key, cached) -> {
            if (cached != null && cached.version() > entity.version()) {
                LOG.debug("Keep cached {} {} at version {}, ignore version {}",
                    kind, id, cached.version(), entity.version());
                writes.labels(kind.table(), "outdated").inc();
                return cached;
            }
            writes.labels(kind.table(), "stored").inc();
            return entity;
        });
    }

    @Override
    public void invalidate(EntityKind kind, long id) {
        entries.invalidate(new CacheKey(kind, id));
        writes.labels(kind.table(), "invalidated").inc();
    }

    public long size() {
        return entries.size();
    }
}
