package io.github.citesync.refs;

import com.vladsch.flexmark.util.data.DataHolder;
import com.vladsch.flexmark.util.data.MutableDataSet;
import io.github.citesync.doc.ChildArrayReconciler;
import io.github.citesync.doc.DocumentChange;
import io.github.citesync.doc.DocumentChangeListener;
import io.github.citesync.doc.DocumentSession;
import io.github.citesync.doc.NodeData;
import io.github.citesync.doc.NodeStateChange;
import io.github.citesync.doc.ReconcileResult;
import io.github.citesync.entity.EntityResolver;
import io.github.citesync.entity.EntityStore;
import io.github.citesync.refs.NodeStateTable.EntryState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps citation labels and bibliography positions in sync with the document.
 * <p>
 * Listens to committed document changes. When a change touches citations, a label update is
 * scheduled to run after the current unit of work: node state must not be rewritten while the host
 * is still finishing the transaction that triggered the notification. Further relevant changes that
 * arrive before the update runs are folded into it. The update reads the citations fresh from the
 * document, replaces the {@link NodeStateTable}, and publishes a single {@link NodeStateChange}.
 */
public class ReferenceManager {
    private static final Logger logger = LogManager.getLogger(ReferenceManager.class);

    private final DocumentSession documentSession;
    private final EntityResolver entities;
    private final String refType;
    private final String citationSelector;
    private final ChangeClassifier classifier;
    private final CitationLabelComputer computer;
    private final CoalescingScheduler scheduler;
    private final DocumentChangeListener changeListener = this::onDocumentChange;

    // written on the scheduler's thread, read by host callers
    private volatile NodeStateTable state = NodeStateTable.EMPTY;
    private volatile boolean disposed = false;

    public ReferenceManager(DocumentSession documentSession, EntityStore entityStore) {
        this(documentSession, entityStore, new MutableDataSet());
    }

    /**
     * Creates the manager, computes the initial labels and starts listening to the document.
     *
     * @param documentSession the document to keep in sync
     * @param entityStore     source of bibliographic metadata
     * @param options         see {@link ReferenceOptions}
     */
    public ReferenceManager(DocumentSession documentSession, EntityStore entityStore, DataHolder options) {
        this.documentSession = Objects.requireNonNull(documentSession, "'documentSession' is mandatory.");
        Objects.requireNonNull(entityStore, "'entityStore' is mandatory.");
        Objects.requireNonNull(options, "options");

        this.entities = new EntityResolver(entityStore);
        this.refType = ReferenceOptions.CITATION_REF_TYPE.get(options);
        this.citationSelector = CitationMarker.selector(refType);
        this.classifier = new ChangeClassifier(documentSession, refType);
        this.computer = new CitationLabelComputer(ReferenceOptions.LABEL_GENERATOR.get(options));
        this.scheduler = new CoalescingScheduler(ReferenceOptions.SCHEDULER.get(options), this::updateCitationLabels);

        documentSession.addChangeListener(changeListener);
        logger.debug("ReferenceManager attached, citations matched by {}", citationSelector);

        // no transaction is in flight yet, so the initial labels can be computed right away
        updateCitationLabels();
    }

    /**
     * Stops listening to the document and drops any pending label update.
     */
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        documentSession.removeChangeListener(changeListener);
        scheduler.cancel();
        logger.debug("ReferenceManager disposed");
    }

    /**
     * Updates the bibliography so that its entries, in order, carry exactly the given identifiers.
     * Entries whose identifier is kept are reused, not recreated.
     *
     * @param newRefs desired bibliography identifiers, in order
     * @return the edits applied to the bibliography list
     * @throws IllegalStateException if the document has no bibliography list
     */
    public ReconcileResult updateReferences(List<String> newRefs) {
        String refListId = documentSession.find(BibliographyEntry.REF_LIST)
                .map(NodeData::id)
                .orElseThrow(() -> new IllegalStateException("Document has no " + BibliographyEntry.REF_LIST));
        List<String> oldRefs = getReferenceIds();

        var result = new AtomicReference<ReconcileResult>();
        documentSession.transaction(tx -> result.set(ChildArrayReconciler.reconcile(
                documentSession, tx, refListId, BibliographyEntry.REF, CitationMarker.RID_ATTRIBUTE, oldRefs, newRefs)));

        // new entries need positions and labels too
        if (!result.get().isEmpty() && !disposed) {
            scheduler.schedule();
        }
        return result.get();
    }

    /**
     * Returns the identifiers of the bibliography entries, in list order.
     */
    public List<String> getReferenceIds() {
        return documentSession.findAll(BibliographyEntry.SELECTOR).stream()
                .map(ref -> ref.getAttribute(CitationMarker.RID_ATTRIBUTE))
                .toList();
    }

    /**
     * Returns the bibliography entries with labels and metadata, ordered by citation position.
     * Uncited entries come last.
     */
    public List<BibliographyEntry> getBibliography() {
        NodeStateTable table = state;
        return documentSession.findAll(BibliographyEntry.SELECTOR).stream()
                .map(ref -> {
                    String rid = ref.getAttribute(CitationMarker.RID_ATTRIBUTE);
                    EntryState entry = table.entry(ref.id());
                    return new BibliographyEntry(ref.id(), rid, entry.position(), entry.label(), entities.resolve(rid));
                })
                .sorted(BibliographyEntry.BY_POSITION)
                .toList();
    }

    /**
     * Entries a citation can point to; same as {@link #getBibliography()}.
     */
    public List<BibliographyEntry> getAvailableResources() {
        return getBibliography();
    }

    public Optional<String> getMarkerLabel(String xrefId) {
        return state.markerLabel(xrefId);
    }

    public EntryState getEntryState(String refId) {
        return state.entry(refId);
    }

    /**
     * Whether a label update is scheduled but has not run yet.
     */
    public boolean isPending() {
        return scheduler.isPending();
    }

    private void onDocumentChange(DocumentChange change) {
        if (disposed) {
            return;
        }
        if (!classifier.isRelevant(change.ops())) {
            return;
        }
        if (scheduler.schedule()) {
            logger.debug("Scheduled citation label update");
        }
    }

    /**
     * Recomputes every citation and bibliography label from the current document.
     * Does nothing when the document has no citations.
     */
    void updateCitationLabels() {
        if (disposed) {
            return;
        }
        List<CitationMarker> markers = documentSession.findAll(citationSelector).stream()
                .filter(node -> CitationMarker.isInScope(node, refType))
                .map(CitationMarker::from)
                .toList();
        if (markers.isEmpty()) {
            logger.debug("No citations found, labels left untouched");
            return;
        }

        CitationLabels labels = computer.compute(markers);
        Set<String> updated = new LinkedHashSet<>();

        Map<String, String> markerLabels = new HashMap<>();
        for (CitationMarker marker : markers) {
            markerLabels.put(marker.id(), Objects.requireNonNullElse(labels.markerLabels().get(marker.id()), ""));
            updated.add(marker.id());
        }

        Map<String, EntryState> entries = new HashMap<>();
        for (NodeData ref : documentSession.findAll(BibliographyEntry.SELECTOR)) {
            String rid = ref.getAttribute(CitationMarker.RID_ATTRIBUTE);
            Integer pos = labels.order().get(rid);
            entries.put(ref.id(), pos == null
                    ? EntryState.UNCITED
                    : new EntryState(OptionalInt.of(pos), Objects.requireNonNullElse(labels.entryLabels().get(rid), "")));
            // warm the metadata cache; misses are retried on the next update
            entities.resolve(rid);
            updated.add(ref.id());
        }
        // mark the list itself so observers of the whole bibliography refresh too
        documentSession.find(BibliographyEntry.REF_LIST).ifPresent(refList -> updated.add(refList.id()));

        state = new NodeStateTable(markerLabels, entries);
        logger.debug("Updated labels for {} citations and {} bibliography entries", markers.size(), entries.size());
        documentSession.publishStateChange(new NodeStateChange(updated));
    }
}
