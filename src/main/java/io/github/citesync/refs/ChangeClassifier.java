package io.github.citesync.refs;

import io.github.citesync.doc.DocumentSession;
import io.github.citesync.doc.MutationOp;
import io.github.citesync.doc.NodeData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a batch of document operations can change citation order or labels.
 * <p>
 * A batch is relevant when any single operation
 * <ol>
 *     <li>creates or deletes an xref of the citation kind,</li>
 *     <li>sets {@code ref-type} from or to the citation kind,</li>
 *     <li>sets {@code rid} on a node that currently is an xref of the citation kind, or</li>
 *     <li>moves a node that currently is, or contains, an xref of the citation kind.</li>
 * </ol>
 * Rules 3 and 4 look at the live document; a node that no longer exists makes that operation irrelevant.
 */
public class ChangeClassifier {
    private static final Logger logger = LogManager.getLogger(ChangeClassifier.class);

    private final DocumentSession documentSession;
    private final String refType;
    private final String citationSelector;

    public ChangeClassifier(DocumentSession documentSession, String refType) {
        this.documentSession = Objects.requireNonNull(documentSession, "documentSession");
        this.refType = Objects.requireNonNull(refType, "refType");
        this.citationSelector = CitationMarker.selector(refType);
    }

    public boolean isRelevant(List<MutationOp> ops) {
        for (MutationOp op : ops) {
            if (isRelevant(op)) {
                logger.debug("Citation-relevant operation on {}: {}", op.nodeId(), op);
                return true;
            }
        }
        return false;
    }

    boolean isRelevant(MutationOp op) {
        if (op instanceof MutationOp.Create create) {
            return isCitation(create.node());
        }
        if (op instanceof MutationOp.Delete delete) {
            return isCitation(delete.node());
        }
        if (op instanceof MutationOp.SetAttribute set) {
            if (CitationMarker.REF_TYPE_ATTRIBUTE.equals(set.attribute())) {
                return refType.equals(set.oldValue()) || refType.equals(set.newValue());
            }
            if (CitationMarker.RID_ATTRIBUTE.equals(set.attribute())) {
                return documentSession.get(set.nodeId()).map(this::isCitation).orElse(false);
            }
            return false;
        }
        if (op instanceof MutationOp.Move move) {
            return documentSession.findAllWithin(move.nodeId(), citationSelector).stream()
                    .anyMatch(this::isCitation);
        }
        return false;
    }

    private boolean isCitation(NodeData node) {
        return CitationMarker.isInScope(node, refType);
    }
}
