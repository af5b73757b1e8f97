package io.github.citesync.entity;

import java.util.List;

/**
 * Bibliographic metadata for one citable work, owned by an {@link EntityStore}.
 */
public record EntityRecord(String id, String type, List<String> authors, String title, String source, Integer year) {

    public EntityRecord {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }
}
