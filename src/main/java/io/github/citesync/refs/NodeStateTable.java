package io.github.citesync.refs;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Derived, non-persisted citation state keyed by node id. Instances are immutable; every recompute
 * builds a new table that replaces the previous one as a whole.
 */
public final class NodeStateTable {
    public static final NodeStateTable EMPTY = new NodeStateTable(Map.of(), Map.of());

    /**
     * State of one bibliography entry node.
     *
     * @param position 1-based position by first citation, empty when the entry is not cited
     * @param label    display label, empty string when the entry is not cited
     */
    public record EntryState(OptionalInt position, String label) {
        public static final EntryState UNCITED = new EntryState(OptionalInt.empty(), "");
    }

    private final Map<String, String> markerLabels;
    private final Map<String, EntryState> entries;

    public NodeStateTable(Map<String, String> markerLabels, Map<String, EntryState> entries) {
        this.markerLabels = Map.copyOf(markerLabels);
        this.entries = Map.copyOf(entries);
    }

    public Optional<String> markerLabel(String xrefId) {
        return Optional.ofNullable(markerLabels.get(xrefId));
    }

    /**
     * Returns the state of a bibliography entry node; unknown nodes are reported as uncited.
     */
    public EntryState entry(String refId) {
        return entries.getOrDefault(refId, EntryState.UNCITED);
    }
}
