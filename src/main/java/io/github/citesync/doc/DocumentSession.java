package io.github.citesync.doc;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The host document as seen by the citation engine: selector-based lookup, transactional edits,
 * and two notification channels (committed document changes, and derived node-state changes).
 * <p>
 * Selectors are CSS selectors. {@link #findAll(String)} returns nodes in document (pre-order) order.
 */
public interface DocumentSession {

    /**
     * Returns the first node in document order matching the selector.
     */
    Optional<NodeData> find(String selector);

    /**
     * Returns all nodes matching the selector, in document order.
     */
    List<NodeData> findAll(String selector);

    /**
     * Returns the nodes matching the selector within the subtree rooted at {@code rootId}
     * (the root included), in document order. An unknown root yields an empty list.
     */
    List<NodeData> findAllWithin(String rootId, String selector);

    /**
     * Looks up a node by its stable id.
     */
    Optional<NodeData> get(String id);

    /**
     * Returns the direct children of {@code parentId} whose type equals {@code type}, in order.
     *
     * @throws IllegalArgumentException if the parent does not exist
     */
    List<NodeData> children(String parentId, String type);

    /**
     * Runs {@code body} as one transaction. Listeners are notified once, after the body returns,
     * with every operation it produced; an empty transaction notifies nobody.
     *
     * @throws IllegalStateException if called while another transaction is running
     */
    void transaction(Consumer<DocumentTransaction> body);

    void addChangeListener(DocumentChangeListener listener);

    void removeChangeListener(DocumentChangeListener listener);

    void addStateListener(NodeStateListener listener);

    void removeStateListener(NodeStateListener listener);

    /**
     * Forwards a derived-state notification to every registered {@link NodeStateListener}.
     */
    void publishStateChange(NodeStateChange change);

    /**
     * Edit operations available inside {@link #transaction(Consumer)}.
     */
    interface DocumentTransaction {

        /**
         * Creates a node of the given type under {@code parentId}, right before {@code beforeId},
         * or as the last child when {@code beforeId} is null.
         *
         * @return the id of the new node (taken from the {@code id} attribute when supplied)
         */
        String create(String parentId, String beforeId, String type, Map<String, String> attributes);

        /**
         * Removes the node and its subtree.
         */
        void delete(String id);

        /**
         * Sets an attribute; an empty value removes it. Setting the current value is a no-op.
         */
        void setAttribute(String id, String name, String value);

        /**
         * Moves the node, keeping its identity, right before {@code beforeId} under the same parent,
         * or to the end of its parent when {@code beforeId} is null.
         */
        void moveBefore(String id, String beforeId);
    }
}
