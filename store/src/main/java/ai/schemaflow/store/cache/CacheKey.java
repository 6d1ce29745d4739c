package ai.schemaflow.store.cache;

import ai.schemaflow.store.model.EntityKind;

record CacheKey(EntityKind kind, long id) {}
