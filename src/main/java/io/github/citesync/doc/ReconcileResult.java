package io.github.citesync.doc;

import java.util.List;

/**
 * Structural edits made by one {@link ChildArrayReconciler} pass, as lists of keys.
 */
public record ReconcileResult(
        /** Keys that got a newly created child. */
        List<String> inserted,
        /** Keys whose child was deleted. */
        List<String> removed,
        /** Keys whose existing child was moved to a new position. */
        List<String> moved
) {
    public ReconcileResult {
        inserted = List.copyOf(inserted);
        removed = List.copyOf(removed);
        moved = List.copyOf(moved);
    }

    public boolean isEmpty() {
        return inserted.isEmpty() && removed.isEmpty() && moved.isEmpty();
    }

    public int editCount() {
        return inserted.size() + removed.size() + moved.size();
    }
}
