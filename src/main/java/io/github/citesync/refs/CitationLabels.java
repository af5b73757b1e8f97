package io.github.citesync.refs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one {@link CitationLabelComputer} pass.
 *
 * @param order        1-based position per bibliography identifier, in order of first citation
 * @param markerLabels label per xref node id
 * @param entryLabels  label per cited bibliography identifier
 */
public record CitationLabels(Map<String, Integer> order,
                             Map<String, String> markerLabels,
                             Map<String, String> entryLabels) {

    public static final CitationLabels EMPTY = new CitationLabels(Map.of(), Map.of(), Map.of());

    public CitationLabels {
        order = Collections.unmodifiableMap(new LinkedHashMap<>(order));
        markerLabels = Collections.unmodifiableMap(new LinkedHashMap<>(markerLabels));
        entryLabels = Collections.unmodifiableMap(new LinkedHashMap<>(entryLabels));
    }

    public boolean isEmpty() {
        return order.isEmpty() && markerLabels.isEmpty();
    }
}
