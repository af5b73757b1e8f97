package io.github.citesync.refs;

import io.github.citesync.entity.EntityRecord;

import java.util.Comparator;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * View of one bibliography entry ({@code ref} node) with its derived state and resolved metadata.
 *
 * @param id       node id of the ref
 * @param rid      bibliography identifier
 * @param position 1-based position by first citation, empty when not cited
 * @param label    display label, empty string when not cited
 * @param entity   resolved metadata, empty when the entity store has no record yet
 */
public record BibliographyEntry(String id,
                                String rid,
                                OptionalInt position,
                                String label,
                                Optional<EntityRecord> entity) {
    public static final String REF_LIST = "ref-list";
    public static final String REF = "ref";
    public static final String SELECTOR = REF_LIST + " > " + REF;

    /**
     * Cited entries by ascending position, then uncited entries; ties by identifier, then node id.
     */
    public static final Comparator<BibliographyEntry> BY_POSITION =
            Comparator.comparing((BibliographyEntry e) -> e.position().isEmpty())
                      .thenComparingInt(e -> e.position().orElse(0))
                      .thenComparing(BibliographyEntry::rid)
                      .thenComparing(BibliographyEntry::id);

    public boolean isCited() {
        return position.isPresent();
    }
}
