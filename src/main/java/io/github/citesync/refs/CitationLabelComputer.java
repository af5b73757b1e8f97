package io.github.citesync.refs;

import io.github.citesync.refs.label.LabelGenerator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes citation order and labels.
 * <p>
 * Bibliography entries are numbered by the order in which they are first cited. Given the citations
 * in document order, e.g.
 * <pre>
 *   cite1 -> [AB06, Mac10]
 *   cite2 -> [FW15]
 *   cite3 -> [Mac10, AB06, AB07]
 * </pre>
 * the positions are AB06=1, Mac10=2, FW15=3, AB07=4 and the citation labels are built from
 * [1,2], [3] and [2,1,4]. A citation keeps its own order of identifiers, duplicates included.
 */
public class CitationLabelComputer {
    private final LabelGenerator labelGenerator;

    public CitationLabelComputer(LabelGenerator labelGenerator) {
        this.labelGenerator = Objects.requireNonNull(labelGenerator, "labelGenerator");
    }

    /**
     * @param markers in-scope citations in document order
     */
    public CitationLabels compute(List<CitationMarker> markers) {
        if (markers.isEmpty()) {
            return CitationLabels.EMPTY;
        }

        int pos = 1;
        Map<String, Integer> order = new LinkedHashMap<>();
        Map<String, String> entryLabels = new HashMap<>();
        Map<String, String> markerLabels = new LinkedHashMap<>();
        for (CitationMarker marker : markers) {
            List<Integer> numbers = new ArrayList<>(marker.rids().size());
            for (String rid : marker.rids()) {
                Integer assigned = order.get(rid);
                if (assigned == null) {
                    assigned = pos++;
                    order.put(rid, assigned);
                    entryLabels.put(rid, labelGenerator.getLabel(assigned));
                }
                numbers.add(assigned);
            }
            markerLabels.put(marker.id(), labelGenerator.getLabel(numbers));
        }
        return new CitationLabels(order, markerLabels, entryLabels);
    }
}
