package io.github.citesync.doc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Utility for syncing the keyed children of a container node with a desired key sequence.
 * Existing children are reused whenever their key survives, so node identity (and anything keyed by
 * node id) is preserved across the update.
 * <p>
 * The edit script is minimal: children whose key disappears are deleted, keys without a child get a new
 * one, and among the surviving children only those outside a longest increasing subsequence of target
 * positions are moved.
 */
public final class ChildArrayReconciler {
    private static final Logger logger = LogManager.getLogger(ChildArrayReconciler.class);

    private ChildArrayReconciler() {
    }

    /**
     * Reconciles the {@code childType} children of {@code containerId} so that their
     * {@code keyAttribute} values, read in order, equal {@code newKeys}.
     *
     * @param session      the document, used to read the live children
     * @param tx           the transaction the edits are recorded in
     * @param containerId  id of the container node
     * @param childType    type of the keyed children
     * @param keyAttribute attribute holding each child's key
     * @param oldKeys      the keys the caller believes are present, in order
     * @param newKeys      the desired keys, in order; duplicates are allowed
     * @return the edits that were applied
     */
    public static ReconcileResult reconcile(DocumentSession session,
                                            DocumentSession.DocumentTransaction tx,
                                            String containerId,
                                            String childType,
                                            String keyAttribute,
                                            List<String> oldKeys,
                                            List<String> newKeys) {
        List<NodeData> current = session.children(containerId, childType);
        List<String> liveKeys = current.stream().map(n -> n.getAttribute(keyAttribute)).toList();
        if (!liveKeys.equals(oldKeys)) {
            logger.warn("Stale keys for {}: expected {} but found {}; using the document's keys",
                        containerId, oldKeys, liveKeys);
        }

        // Pair each desired key with an existing child, first come first served
        Map<String, Deque<NodeData>> available = new HashMap<>();
        for (NodeData child : current) {
            available.computeIfAbsent(child.getAttribute(keyAttribute), k -> new ArrayDeque<>()).add(child);
        }
        NodeData[] assigned = new NodeData[newKeys.size()];
        Map<String, Integer> targetIndex = new HashMap<>();
        for (int i = 0; i < newKeys.size(); i++) {
            Deque<NodeData> candidates = available.get(newKeys.get(i));
            if (candidates != null && !candidates.isEmpty()) {
                assigned[i] = candidates.poll();
                targetIndex.put(assigned[i].id(), i);
            }
        }

        var removed = new ArrayList<String>();
        var retained = new ArrayList<NodeData>();
        for (NodeData child : current) {
            if (targetIndex.containsKey(child.id())) {
                retained.add(child);
            } else {
                logger.debug("Removing {} {} ({})", childType, child.id(), child.getAttribute(keyAttribute));
                tx.delete(child.id());
                removed.add(child.getAttribute(keyAttribute));
            }
        }

        // Survivors already in the right relative order stay put
        int[] targets = retained.stream().mapToInt(n -> targetIndex.get(n.id())).toArray();
        Set<String> stable = new HashSet<>();
        for (int pos : longestIncreasingSubsequence(targets)) {
            stable.add(retained.get(pos).id());
        }

        // Walk backwards so every placed child has its successor already in its final position
        var inserted = new ArrayList<String>();
        var moved = new ArrayList<String>();
        String anchor = null;
        for (int i = newKeys.size() - 1; i >= 0; i--) {
            String key = newKeys.get(i);
            NodeData child = assigned[i];
            String id;
            if (child == null) {
                id = tx.create(containerId, anchor, childType, Map.of(keyAttribute, key));
                inserted.add(key);
                logger.debug("Inserted {} {} ({})", childType, id, key);
            } else {
                id = child.id();
                if (!stable.contains(id)) {
                    tx.moveBefore(id, anchor);
                    moved.add(key);
                    logger.debug("Moved {} {} ({})", childType, id, key);
                }
            }
            anchor = id;
        }

        Collections.reverse(inserted);
        Collections.reverse(moved);
        var result = new ReconcileResult(inserted, removed, moved);
        logger.debug("Reconciled {}: {} inserted, {} removed, {} moved",
                     containerId, inserted.size(), removed.size(), moved.size());
        return result;
    }

    /**
     * Returns the indices (ascending) of one longest strictly increasing subsequence of {@code values}.
     */
    static int[] longestIncreasingSubsequence(int[] values) {
        int n = values.length;
        int[] tails = new int[n];  // index of the smallest tail for each length
        int[] prev = new int[n];
        int length = 0;
        for (int i = 0; i < n; i++) {
            int lo = 0;
            int hi = length;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (values[tails[mid]] < values[i]) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            prev[i] = lo > 0 ? tails[lo - 1] : -1;
            tails[lo] = i;
            if (lo == length) {
                length++;
            }
        }

        int[] result = new int[length];
        int k = length > 0 ? tails[length - 1] : -1;
        for (int j = length - 1; j >= 0; j--) {
            result[j] = k;
            k = prev[k];
        }
        return result;
    }
}
