package dev.badgersnacks.compendium.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A concrete catalog entry generated from one template and one base item.
 *
 * @param variantOf name of the template that produced the item
 * @param baseItem  {@code name|source} of the matched base item
 */
public record ExpandedItem(
        String name,
        String source,
        String itemType,
        String rarity,
        ObjectNode data,
        String variantOf,
        String baseItem
) {

    public ExpandedItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(variantOf, "variantOf");
        Objects.requireNonNull(baseItem, "baseItem");
    }

    public ItemKey key() {
        return new ItemKey(name, source);
    }
}
