package io.github.citesync.entity;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily resolves entity records and keeps the first successful lookup per identifier.
 * Misses are not cached, so a record that shows up in the store later is picked up on the next call.
 * Cached records are never invalidated.
 */
public class EntityResolver {
    private static final Logger logger = LogManager.getLogger(EntityResolver.class);

    private final EntityStore store;
    private final Map<String, EntityRecord> cache = new ConcurrentHashMap<>();

    public EntityResolver(EntityStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public Optional<EntityRecord> resolve(String id) {
        EntityRecord cached = cache.get(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<EntityRecord> found = store.get(id);
        if (found.isEmpty()) {
            logger.debug("No entity record for {}", id);
            return Optional.empty();
        }
        // first writer wins
        EntityRecord previous = cache.putIfAbsent(id, found.get());
        return Optional.of(previous != null ? previous : found.get());
    }

    public boolean isCached(String id) {
        return cache.containsKey(id);
    }
}
