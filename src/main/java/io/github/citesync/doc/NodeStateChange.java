package io.github.citesync.doc;

import java.util.Set;

/**
 * Notification that the derived (non-persisted) state of some nodes was rewritten.
 * Observers such as renderers re-read whatever they display for the named nodes.
 */
public record NodeStateChange(Set<String> updated) {

    public NodeStateChange {
        updated = Set.copyOf(updated);
    }

    public boolean isUpdated(String nodeId) {
        return updated.contains(nodeId);
    }
}
