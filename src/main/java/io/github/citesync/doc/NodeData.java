package io.github.citesync.doc;

import java.util.Map;

/**
 * Immutable snapshot of a document node: its stable id, its type (element name) and its attributes.
 * Snapshots are taken at read time; they do not follow later edits of the node.
 */
public record NodeData(String id, String type, Map<String, String> attributes) {

    public NodeData {
        attributes = Map.copyOf(attributes);
    }

    /**
     * Returns the attribute value, or an empty string when the attribute is absent.
     */
    public String getAttribute(String name) {
        return attributes.getOrDefault(name, "");
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }
}
