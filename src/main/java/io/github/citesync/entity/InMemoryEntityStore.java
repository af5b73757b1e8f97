package io.github.citesync.entity;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link EntityStore}.
 */
public class InMemoryEntityStore implements EntityStore {
    private final Map<String, EntityRecord> records = new ConcurrentHashMap<>();

    public InMemoryEntityStore put(EntityRecord record) {
        records.put(record.id(), record);
        return this;
    }

    public void remove(String id) {
        records.remove(id);
    }

    @Override
    public Optional<EntityRecord> get(String id) {
        return Optional.ofNullable(records.get(id));
    }
}
