package io.github.citesync.refs;

import io.github.citesync.doc.NodeData;
import io.github.citesync.refs.label.NumberedLabelGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CitationLabelComputer.
 */
class CitationLabelComputerTest {
    private final CitationLabelComputer computer = new CitationLabelComputer(new NumberedLabelGenerator());

    private static CitationMarker marker(String id, String... rids) {
        return new CitationMarker(id, List.of(rids));
    }

    @Test
    void positionsFollowFirstCitation() {
        var labels = computer.compute(List.of(marker("x1", "B", "A"), marker("x2", "A", "C")));

        assertEquals(Map.of("B", 1, "A", 2, "C", 3), labels.order());
        assertEquals(List.of("B", "A", "C"), List.copyOf(labels.order().keySet()));
    }

    @Test
    void markerLabelKeepsItsOwnOrder() {
        var labels = computer.compute(List.of(marker("x1", "B", "A"), marker("x2", "A", "C")));

        assertEquals("1,2", labels.markerLabels().get("x1"));
        assertEquals("2,3", labels.markerLabels().get("x2"));
        assertEquals(Map.of("B", "1", "A", "2", "C", "3"), labels.entryLabels());
    }

    @Test
    void laterCitationsInReverseOrderAreNotSorted() {
        var labels = computer.compute(List.of(
                marker("cite1", "AB06", "Mac10"),
                marker("cite2", "FW15"),
                marker("cite3", "Mac10", "AB06", "AB07")));

        assertEquals("2,1,4", labels.markerLabels().get("cite3"));
        assertEquals(4, labels.order().get("AB07"));
    }

    @Test
    void duplicatesInsideOneMarkerAreKept() {
        var labels = computer.compute(List.of(marker("x1", "A", "A", "B")));

        assertEquals("1,1,2", labels.markerLabels().get("x1"));
        assertEquals(Map.of("A", 1, "B", 2), labels.order());
    }

    @Test
    void markerWithoutRidsGetsEmptyLabel() {
        var empty = CitationMarker.from(new NodeData("x1", "xref", Map.of("ref-type", "bibr", "rid", "  ")));
        var labels = computer.compute(List.of(empty, marker("x2", "A")));

        assertTrue(empty.rids().isEmpty());
        assertEquals("", labels.markerLabels().get("x1"));
        assertEquals(1, labels.order().get("A"));
    }

    @Test
    void noMarkersGiveEmptyResult() {
        var labels = computer.compute(List.of());

        assertTrue(labels.isEmpty());
        assertTrue(labels.entryLabels().isEmpty());
    }

    @Test
    void computingTwiceGivesTheSameResult() {
        var markers = List.of(marker("x1", "C", "B"), marker("x2", "A"), marker("x3", "B", "D"));

        assertEquals(computer.compute(markers), computer.compute(markers));
    }

    @Test
    void ridAttributeIsSplitOnWhitespace() {
        var marker = CitationMarker.from(new NodeData("x1", "xref", Map.of("rid", " A  B\tC ")));

        assertEquals(List.of("A", "B", "C"), marker.rids());
        assertEquals("xref[ref-type=bibr]", CitationMarker.selector("bibr"));
    }
}
