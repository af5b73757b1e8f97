package io.github.citesync.doc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A {@link DocumentSession} over a jsoup XML tree.
 * <p>
 * Every element carries a unique {@code id} attribute; missing or duplicate ids are replaced on load.
 * Edits go through {@link #transaction(Consumer)}, which records one {@link MutationOp} per low-level
 * change and hands them to the change listeners after the body completes.
 */
public class XmlDocumentSession implements DocumentSession {
    private static final Logger logger = LogManager.getLogger(XmlDocumentSession.class);

    private final Document doc;
    private final NodeIdProvider idProvider = new NodeIdProvider();
    private final Map<String, Element> index = new HashMap<>();

    private final List<DocumentChangeListener> changeListeners = new CopyOnWriteArrayList<>();
    private final List<NodeStateListener> stateListeners = new CopyOnWriteArrayList<>();

    private boolean inTransaction = false;

    private XmlDocumentSession(Document doc) {
        this.doc = doc;
        indexTree(doc);
    }

    /**
     * Parses an XML document and opens a session on it.
     */
    public static XmlDocumentSession parse(String xml) {
        Objects.requireNonNull(xml, "xml");
        return new XmlDocumentSession(Jsoup.parse(xml, "", Parser.xmlParser()));
    }

    private void indexTree(Document doc) {
        // claim source ids first so generated ones never collide with an id further down
        for (Element el : doc.getAllElements()) {
            String id = el.attr("id");
            if (el != doc && idProvider.reserve(id)) {
                index.put(id, el);
            }
        }
        for (Element el : doc.getAllElements()) {
            if (el == doc) {
                continue;
            }
            String id = el.attr("id");
            if (index.get(id) != el) {
                String fresh = idProvider.nextId(el.tagName());
                if (!id.isEmpty()) {
                    logger.warn("Duplicate node id {} on <{}>, reassigned to {}", id, el.tagName(), fresh);
                }
                el.attr("id", fresh);
                id = fresh;
            }
            index.put(id, el);
        }
        logger.debug("Indexed {} nodes", index.size());
    }

    /**
     * Serializes the current tree.
     */
    public String toXml() {
        return doc.outerHtml();
    }

    @Override
    public Optional<NodeData> find(String selector) {
        return Optional.ofNullable(doc.selectFirst(selector)).map(XmlDocumentSession::snapshot);
    }

    @Override
    public List<NodeData> findAll(String selector) {
        return doc.select(selector).stream()
                .filter(el -> el != doc)
                .map(XmlDocumentSession::snapshot)
                .toList();
    }

    @Override
    public List<NodeData> findAllWithin(String rootId, String selector) {
        Element root = index.get(rootId);
        if (root == null) {
            return List.of();
        }
        return root.select(selector).stream()
                .map(XmlDocumentSession::snapshot)
                .toList();
    }

    @Override
    public Optional<NodeData> get(String id) {
        return Optional.ofNullable(index.get(id)).map(XmlDocumentSession::snapshot);
    }

    @Override
    public List<NodeData> children(String parentId, String type) {
        Element parent = require(parentId);
        return parent.children().stream()
                .filter(el -> el.tagName().equals(type))
                .map(XmlDocumentSession::snapshot)
                .toList();
    }

    @Override
    public void transaction(Consumer<DocumentTransaction> body) {
        if (inTransaction) {
            throw new IllegalStateException("A transaction is already running");
        }
        inTransaction = true;
        var tx = new XmlTransaction();
        try {
            body.accept(tx);
        } finally {
            inTransaction = false;
        }

        if (tx.ops.isEmpty()) {
            logger.debug("Transaction produced no operations");
            return;
        }
        var change = new DocumentChange(tx.ops);
        logger.debug("Committed transaction with {} operations", change.ops().size());
        for (DocumentChangeListener listener : changeListeners) {
            try {
                listener.documentChanged(change);
            } catch (RuntimeException e) {
                logger.error("Document change listener {} failed", listener, e);
            }
        }
    }

    @Override
    public void addChangeListener(DocumentChangeListener listener) {
        changeListeners.add(Objects.requireNonNull(listener));
    }

    @Override
    public void removeChangeListener(DocumentChangeListener listener) {
        changeListeners.remove(listener);
    }

    @Override
    public void addStateListener(NodeStateListener listener) {
        stateListeners.add(Objects.requireNonNull(listener));
    }

    @Override
    public void removeStateListener(NodeStateListener listener) {
        stateListeners.remove(listener);
    }

    @Override
    public void publishStateChange(NodeStateChange change) {
        for (NodeStateListener listener : stateListeners) {
            try {
                listener.stateChanged(change);
            } catch (RuntimeException e) {
                logger.error("Node state listener {} failed", listener, e);
            }
        }
    }

    private Element require(String id) {
        Element el = id == null ? null : index.get(id);
        if (el == null) {
            throw new IllegalArgumentException("No node with id " + id);
        }
        return el;
    }

    private static NodeData snapshot(Element el) {
        var attrs = new LinkedHashMap<String, String>();
        for (Attribute attr : el.attributes()) {
            attrs.put(attr.getKey(), attr.getValue());
        }
        return new NodeData(el.attr("id"), el.tagName(), attrs);
    }

    /**
     * Applies edits to the tree immediately and records them for the commit notification.
     */
    private class XmlTransaction implements DocumentTransaction {
        private final List<MutationOp> ops = new ArrayList<>();

        @Override
        public String create(String parentId, String beforeId, String type, Map<String, String> attributes) {
            Element parent = require(parentId);
            Element anchor = beforeId == null ? null : requireChild(parent, beforeId);

            String id = attributes.getOrDefault("id", "");
            if (id.isEmpty()) {
                id = idProvider.nextId(type);
            } else if (!idProvider.reserve(id)) {
                throw new IllegalArgumentException("Node id already in use: " + id);
            }

            Element el = doc.createElement(type);
            el.attr("id", id);
            attributes.forEach((name, value) -> {
                if (!name.equals("id") && !value.isEmpty()) {
                    el.attr(name, value);
                }
            });
            if (anchor == null) {
                parent.appendChild(el);
            } else {
                anchor.before(el);
            }
            index.put(id, el);

            ops.add(new MutationOp.Create(snapshot(el)));
            return id;
        }

        @Override
        public void delete(String id) {
            Element el = require(id);
            if (el.parent() == null || el.parent() == doc) {
                throw new IllegalArgumentException("Cannot delete the document root");
            }
            // pre-order: the node itself first, then its descendants
            for (Element removed : el.getAllElements()) {
                ops.add(new MutationOp.Delete(snapshot(removed)));
                index.remove(removed.attr("id"));
            }
            el.remove();
        }

        @Override
        public void setAttribute(String id, String name, String value) {
            if (name.equals("id")) {
                throw new IllegalArgumentException("Node ids are immutable");
            }
            Element el = require(id);
            String oldValue = el.attr(name);
            String newValue = value == null ? "" : value;
            if (oldValue.equals(newValue)) {
                return;
            }
            if (newValue.isEmpty()) {
                el.removeAttr(name);
            } else {
                el.attr(name, newValue);
            }
            ops.add(new MutationOp.SetAttribute(id, name, oldValue, newValue));
        }

        @Override
        public void moveBefore(String id, String beforeId) {
            Element el = require(id);
            Element parent = el.parent();
            if (parent == null || parent == doc) {
                throw new IllegalArgumentException("Cannot move the document root");
            }
            Element anchor = beforeId == null ? null : requireChild(parent, beforeId);
            if (anchor == el) {
                return;
            }
            if (anchor == null ? el.nextElementSibling() == null : el.nextElementSibling() == anchor) {
                // already in place
                return;
            }

            el.remove();
            if (anchor == null) {
                parent.appendChild(el);
            } else {
                anchor.before(el);
            }
            ops.add(new MutationOp.Move(id, parent.attr("id")));
        }

        private Element requireChild(Element parent, String childId) {
            Element child = require(childId);
            if (child.parent() != parent) {
                throw new IllegalArgumentException("Node " + childId + " is not a child of " + parent.attr("id"));
            }
            return child;
        }
    }
}
