package ai.schemaflow.store.config;

import ai.schemaflow.model.db.DatabaseConfiguration;
import io.micronaut.context.annotation.ConfigurationBuilder;
import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties("schemaflow")
public class StoreConfig {
    /**
     * Upper bound for a single statement round trip. The driver aborts the statement when it expires and
     * the enclosing transaction is rolled back.
     */
    private Duration queryTimeout = Duration.ofSeconds(30);

    @ConfigurationBuilder("database")
    private final DatabaseConfiguration database = new DatabaseConfiguration();

    @ConfigurationBuilder("cache")
    private final CacheConfig cache = new CacheConfig();

    @Getter
    @Setter
    public static final class CacheConfig {
        private long maximumSize = 10_000;
        private int concurrencyLevel = 4;
    }
}
