package ai.schemaflow.store.db;

import ai.schemaflow.model.db.StorageImpl;
import ai.schemaflow.store.config.StoreConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

@Singleton
@Requires(property = "schemaflow.database.enabled", value = "true")
public class StoreDataSource extends StorageImpl {
    public StoreDataSource(StoreConfig config) {
        super(config.getDatabase(), "classpath:db/store/migrations");
    }
}
