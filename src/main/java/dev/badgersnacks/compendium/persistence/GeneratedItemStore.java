package dev.badgersnacks.compendium.persistence;

import dev.badgersnacks.compendium.model.ExpandedItem;
import dev.badgersnacks.compendium.model.ItemKey;

import java.util.List;

/**
 * Write side used by variant expansion. Implementations may only delete or insert rows that carry variant
 * provenance.
 */
public interface GeneratedItemStore {

    /**
     * Replaces every generated row with {@code items} in one transaction. Items whose key is already taken by a
     * non-generated row are left out and reported in the outcome.
     *
     * @throws CatalogPersistenceException when the transaction fails; nothing is changed in that case
     */
    ReplaceOutcome replaceGeneratedItems(List<ExpandedItem> items);

    record ReplaceOutcome(int deleted, int inserted, List<ItemKey> collisions) {
        public ReplaceOutcome {
            collisions = collisions == null ? List.of() : List.copyOf(collisions);
        }
    }
}
