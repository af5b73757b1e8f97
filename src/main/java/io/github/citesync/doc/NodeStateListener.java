package io.github.citesync.doc;

/**
 * Receives node-state notifications published through {@link DocumentSession#publishStateChange}.
 */
@FunctionalInterface
public interface NodeStateListener {
    void stateChanged(NodeStateChange change);
}
