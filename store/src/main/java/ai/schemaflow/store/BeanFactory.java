package ai.schemaflow.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Factory;
import io.prometheus.client.CollectorRegistry;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

@Factory
public class BeanFactory {

    @Singleton
    @Named("StoreMetricsRegistry")
    public CollectorRegistry metricsRegistry() {
        return new CollectorRegistry(true);
    }

    @Singleton
    @Named("StoreObjectMapper")
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }
}
