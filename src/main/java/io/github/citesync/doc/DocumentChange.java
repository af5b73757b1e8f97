package io.github.citesync.doc;

import java.util.List;

/**
 * The ordered operations of one committed document transaction.
 */
public record DocumentChange(List<MutationOp> ops) {

    public DocumentChange {
        ops = List.copyOf(ops);
    }
}
