package dev.badgersnacks.compendium.variants;

import java.util.List;

/**
 * Summary of one expansion run.
 *
 * @param templatesProcessed   templates that passed validation and were evaluated
 * @param baseItemsConsidered  base items every valid template was evaluated against
 * @param itemsGenerated       rows written to the catalog
 * @param itemsSkipped         generated rows dropped, either superseded by a later duplicate or blocked by an
 *                             existing non-generated row with the same key
 * @param warnings             recoverable problems, in the order they were found
 */
public record ExpansionResult(
        int templatesProcessed,
        int baseItemsConsidered,
        int itemsGenerated,
        int itemsSkipped,
        List<String> warnings
) {

    public ExpansionResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String summary() {
        return itemsGenerated + " generated, " + warnings.size() + " warnings";
    }
}
