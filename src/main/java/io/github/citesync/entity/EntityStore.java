package io.github.citesync.entity;

import java.util.Optional;

/**
 * Read-only lookup of bibliographic records by identifier. Absence is not an error.
 */
@FunctionalInterface
public interface EntityStore {
    Optional<EntityRecord> get(String id);
}
