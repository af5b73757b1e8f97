package io.github.citesync.doc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Hands out stable, unique node ids.
 * <p>
 * Ids are never reused within a session, even after the node they named is deleted, so derived state
 * keyed by a stale id can never be mistaken for state of a newer node.
 */
public class NodeIdProvider {
    private static final Logger logger = LogManager.getLogger(NodeIdProvider.class);

    private final Set<String> used = new HashSet<>();
    private final Map<String, Integer> counters = new HashMap<>();

    /**
     * Claims an id that came from the document source.
     *
     * @return false if the id is blank or already claimed
     */
    public boolean reserve(String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        return used.add(id);
    }

    /**
     * Generates a fresh id derived from the node type, e.g. {@code xref-3}.
     *
     * @param type the node type the id is for
     * @return an id that has not been handed out or reserved before
     */
    public String nextId(String type) {
        int n = counters.getOrDefault(type, 0);
        String id;
        do {
            id = type + "-" + (++n);
        } while (used.contains(id));
        counters.put(type, n);
        used.add(id);

        logger.debug("Generated id {} for {} node", id, type);
        return id;
    }
}
