package ai.schemaflow.model.db;

import lombok.Getter;
import lombok.Setter;

/**
 * Connection settings of one store, bound from {@code <prefix>.database.*}.
 */
@Getter
@Setter
public class DatabaseConfiguration {
    private String url;
    private String username;
    private String password;
    private int minPoolSize = 1;
    private int maxPoolSize = 10;
    private boolean enabled;
}
