package io.github.citesync.doc;

/**
 * A low-level document mutation, as delivered in a {@link DocumentChange}.
 */
public sealed interface MutationOp
    permits MutationOp.Create, MutationOp.Delete, MutationOp.SetAttribute, MutationOp.Move {

    /**
     * Id of the node the operation applies to.
     */
    String nodeId();

    /**
     * A node was inserted. The snapshot reflects the node right after creation.
     */
    record Create(NodeData node) implements MutationOp {
        @Override
        public String nodeId() {
            return node.id();
        }
    }

    /**
     * A node was removed. The snapshot reflects the node right before removal.
     */
    record Delete(NodeData node) implements MutationOp {
        @Override
        public String nodeId() {
            return node.id();
        }
    }

    /**
     * An attribute changed. Absent values are reported as empty strings.
     */
    record SetAttribute(String nodeId, String attribute, String oldValue, String newValue) implements MutationOp {
    }

    /**
     * A node kept its identity but changed position under {@code parentId}.
     */
    record Move(String nodeId, String parentId) implements MutationOp {
    }
}
