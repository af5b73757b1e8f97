package io.github.citesync.refs;

import io.github.citesync.doc.NodeData;

import java.util.Arrays;
import java.util.List;

/**
 * An in-scope cross-reference: an {@code xref} node whose {@code ref-type} is the bibliography sentinel.
 *
 * @param id   stable node id of the xref
 * @param rids referenced bibliography identifiers, in the order the xref lists them
 */
public record CitationMarker(String id, List<String> rids) {
    public static final String XREF = "xref";
    public static final String REF_TYPE_ATTRIBUTE = "ref-type";
    public static final String RID_ATTRIBUTE = "rid";

    public CitationMarker {
        rids = List.copyOf(rids);
    }

    /**
     * Reads a marker from an xref snapshot. The {@code rid} attribute is a whitespace-separated list;
     * a blank attribute yields no rids.
     */
    public static CitationMarker from(NodeData xref) {
        String rid = xref.getAttribute(RID_ATTRIBUTE).trim();
        List<String> rids = rid.isEmpty() ? List.of() : Arrays.asList(rid.split("\\s+"));
        return new CitationMarker(xref.id(), rids);
    }

    /**
     * Whether the node is an xref whose {@code ref-type} is exactly the given kind.
     * Case and surrounding whitespace count.
     */
    public static boolean isInScope(NodeData node, String refType) {
        return XREF.equals(node.type()) && refType.equals(node.getAttribute(REF_TYPE_ATTRIBUTE));
    }

    /**
     * CSS selector for candidate xrefs of the given reference kind. jsoup compares the value
     * ignoring case and padding, so results must still pass {@link #isInScope}.
     */
    public static String selector(String refType) {
        return XREF + "[" + REF_TYPE_ATTRIBUTE + "=" + refType + "]";
    }
}
