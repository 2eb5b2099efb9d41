package dev.badgersnacks.compendium.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.badgersnacks.compendium.model.ExpandedItem;
import dev.badgersnacks.compendium.model.ItemKey;

import java.util.Objects;

/**
 * One row of the {@code items} table. {@code variantOf} and {@code baseItem} are {@code null} for every row that
 * was not produced by variant expansion.
 */
public record CatalogItemRow(
        String name,
        String source,
        String itemType,
        String rarity,
        String data,
        String variantOf,
        String baseItem
) {

    public CatalogItemRow {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(data, "data");
    }

    public static CatalogItemRow ingested(String name, String source, String itemType, String rarity, String data) {
        return new CatalogItemRow(name, source, itemType, rarity, data, null, null);
    }

    public static CatalogItemRow fromExpanded(ExpandedItem item, ObjectMapper mapper) {
        try {
            return new CatalogItemRow(item.name(),
                    item.source(),
                    item.itemType(),
                    item.rarity(),
                    mapper.writeValueAsString(item.data()),
                    item.variantOf(),
                    item.baseItem());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise generated item " + item.key().asString(), e);
        }
    }

    public ItemKey key() {
        return new ItemKey(name, source);
    }

    public boolean isGenerated() {
        return variantOf != null;
    }
}
