package io.github.citesync.doc;

import io.github.citesync.TestUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the jsoup-backed host document.
 */
class XmlDocumentSessionTest {
    private XmlDocumentSession session;
    private List<DocumentChange> changes;

    @BeforeEach
    void setUp() {
        session = XmlDocumentSession.parse(TestUtil.ARTICLE);
        changes = new ArrayList<>();
        session.addChangeListener(changes::add);
    }

    @Test
    void findAllReturnsNodesInDocumentOrder() {
        var xrefs = session.findAll("xref[ref-type=bibr]");

        assertEquals(List.of("x1", "x2"), xrefs.stream().map(NodeData::id).toList());
        assertEquals("B A", xrefs.get(0).getAttribute("rid"));
        assertEquals("xref", xrefs.get(0).type());
    }

    @Test
    void missingIdsAreGenerated() {
        var doc = XmlDocumentSession.parse("<article><p>text</p><p id=\"p-1\">more</p></article>");

        var paragraphs = doc.findAll("p");
        assertEquals(2, paragraphs.size());
        assertFalse(paragraphs.get(0).id().isEmpty());
        assertNotEquals("p-1", paragraphs.get(0).id(), "generated ids must not collide with source ids");
        assertEquals("p-1", paragraphs.get(1).id());
        assertTrue(doc.get(paragraphs.get(0).id()).isPresent());
    }

    @Test
    void duplicateIdsAreReassigned() {
        var doc = XmlDocumentSession.parse("<article><p id=\"same\"/><p id=\"same\"/></article>");

        var ids = doc.findAll("p").stream().map(NodeData::id).toList();
        assertEquals("same", ids.get(0));
        assertNotEquals("same", ids.get(1));
    }

    @Test
    void childrenAreFilteredByType() {
        var refs = session.children("refs", "ref");

        assertEquals(List.of("A", "B", "C", "D"), refs.stream().map(r -> r.getAttribute("rid")).toList());
        assertThrows(IllegalArgumentException.class, () -> session.children("nope", "ref"));
    }

    @Test
    void findAllWithinIncludesTheRoot() {
        assertEquals(1, session.findAllWithin("x1", "xref[ref-type=bibr]").size());
        assertEquals(1, session.findAllWithin("p2", "xref[ref-type=bibr]").size());
        assertTrue(session.findAllWithin("back", "xref").isEmpty());
        assertTrue(session.findAllWithin("missing", "xref").isEmpty());
    }

    @Test
    void transactionNotifiesOnceWithAllOperations() {
        session.transaction(tx -> {
            String id = tx.create("p2", null, "xref", Map.of("ref-type", "bibr", "rid", "D"));
            tx.setAttribute(id, "rid", "D A");
            tx.delete("f1");
        });

        assertEquals(1, changes.size());
        var ops = changes.get(0).ops();
        assertEquals(3, ops.size());
        assertInstanceOf(MutationOp.Create.class, ops.get(0));
        var set = assertInstanceOf(MutationOp.SetAttribute.class, ops.get(1));
        assertEquals("D", set.oldValue());
        assertEquals("D A", set.newValue());
        var delete = assertInstanceOf(MutationOp.Delete.class, ops.get(2));
        assertEquals("fig", delete.node().getAttribute("ref-type"));
        assertTrue(session.get("f1").isEmpty());
    }

    @Test
    void emptyTransactionDoesNotNotify() {
        session.transaction(tx -> tx.setAttribute("x1", "rid", "B A"));

        assertTrue(changes.isEmpty());
    }

    @Test
    void deleteReportsTheSubtree() {
        session.transaction(tx -> tx.delete("p1"));

        var deleted = changes.get(0).ops().stream().map(MutationOp::nodeId).toList();
        assertEquals(List.of("p1", "x1", "f1"), deleted);
        assertTrue(session.get("x1").isEmpty());
    }

    @Test
    void createHonoursAnchorAndSuppliedId() {
        session.transaction(tx -> tx.create("refs", "r-B", "ref", Map.of("id", "r-E", "rid", "E")));

        var rids = session.children("refs", "ref").stream().map(r -> r.getAttribute("rid")).toList();
        assertEquals(List.of("A", "E", "B", "C", "D"), rids);
        assertThrows(IllegalArgumentException.class,
                     () -> session.transaction(tx -> tx.create("refs", null, "ref", Map.of("id", "r-E"))));
    }

    @Test
    void moveKeepsIdentity() {
        session.transaction(tx -> tx.moveBefore("r-D", "r-A"));

        var ids = session.children("refs", "ref").stream().map(NodeData::id).toList();
        assertEquals(List.of("r-D", "r-A", "r-B", "r-C"), ids);
        var move = assertInstanceOf(MutationOp.Move.class, changes.get(0).ops().get(0));
        assertEquals("refs", move.parentId());
    }

    @Test
    void moveIntoCurrentPlaceIsANoOp() {
        session.transaction(tx -> {
            tx.moveBefore("r-A", "r-B");
            tx.moveBefore("r-D", null);
        });

        assertTrue(changes.isEmpty());
    }

    @Test
    void attributeEditsRejectIdChangesAndUnknownNodes() {
        assertThrows(IllegalArgumentException.class, () -> session.transaction(tx -> tx.setAttribute("x1", "id", "y")));
        assertThrows(IllegalArgumentException.class, () -> session.transaction(tx -> tx.setAttribute("zz", "rid", "A")));
    }

    @Test
    void emptyValueRemovesAttribute() {
        session.transaction(tx -> tx.setAttribute("x1", "rid", ""));

        assertFalse(session.get("x1").orElseThrow().hasAttribute("rid"));
        var set = (MutationOp.SetAttribute) changes.get(0).ops().get(0);
        assertEquals("", set.newValue());
    }

    @Test
    void nestedTransactionsAreRejected() {
        var error = new ArrayList<Throwable>();
        session.transaction(tx -> {
            tx.setAttribute("p1", "class", "lead");
            try {
                session.transaction(inner -> inner.setAttribute("p2", "class", "lead"));
            } catch (IllegalStateException e) {
                error.add(e);
            }
        });

        assertEquals(1, error.size());
        assertEquals(1, changes.size());
        assertEquals(1, changes.get(0).ops().size());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        var doc = XmlDocumentSession.parse(TestUtil.ARTICLE);
        var received = new ArrayList<DocumentChange>();
        doc.addChangeListener(change -> {
            throw new IllegalStateException("boom");
        });
        doc.addChangeListener(received::add);

        doc.transaction(tx -> tx.setAttribute("p1", "class", "lead"));

        assertEquals(1, received.size());
    }

    @Test
    void stateChangesReachStateListeners() {
        var received = new ArrayList<NodeStateChange>();
        session.addStateListener(received::add);

        session.publishStateChange(new NodeStateChange(Set.of("x1")));

        assertEquals(1, received.size());
        assertTrue(received.get(0).isUpdated("x1"));
        assertTrue(changes.isEmpty());
    }

    @Test
    void serializesCurrentTree() {
        session.transaction(tx -> tx.setAttribute("x1", "rid", "C"));

        assertTrue(session.toXml().contains("rid=\"C\""));
    }
}
