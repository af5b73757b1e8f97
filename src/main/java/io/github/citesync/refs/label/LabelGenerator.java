package io.github.citesync.refs.label;

import java.util.List;

/**
 * Turns citation positions into display labels. Implementations must be pure.
 */
public interface LabelGenerator {

    /**
     * Label for a single bibliography entry at the given 1-based position.
     */
    String getLabel(int position);

    /**
     * Label for a citation that refers to several entries, in the citation's own order.
     * An empty list must not fail.
     */
    String getLabel(List<Integer> positions);
}
