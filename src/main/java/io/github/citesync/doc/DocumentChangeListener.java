package io.github.citesync.doc;

/**
 * Receives one {@link DocumentChange} per committed transaction.
 */
@FunctionalInterface
public interface DocumentChangeListener {
    void documentChanged(DocumentChange change);
}
