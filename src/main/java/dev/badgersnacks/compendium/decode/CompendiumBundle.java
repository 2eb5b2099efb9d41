package dev.badgersnacks.compendium.decode;

import com.fasterxml.jackson.databind.JsonNode;
import dev.badgersnacks.compendium.model.CatalogSource;

import java.util.List;
import java.util.Objects;

/**
 * One source book's already-parsed content, as handed over by the compendium reader.
 *
 * @param baseItems        objects from the base item list ({@code baseitem})
 * @param variantTemplates objects from the generic variant list ({@code magicvariant})
 * @param items            every other item object of the source, ingested as-is
 */
public record CompendiumBundle(
        CatalogSource source,
        List<JsonNode> baseItems,
        List<JsonNode> variantTemplates,
        List<JsonNode> items
) {

    public CompendiumBundle {
        Objects.requireNonNull(source, "source");
        baseItems = baseItems == null ? List.of() : List.copyOf(baseItems);
        variantTemplates = variantTemplates == null ? List.of() : List.copyOf(variantTemplates);
        items = items == null ? List.of() : List.copyOf(items);
    }
}
