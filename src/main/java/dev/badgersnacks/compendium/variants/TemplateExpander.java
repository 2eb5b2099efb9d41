package dev.badgersnacks.compendium.variants;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.compendium.model.BaseItem;
import dev.badgersnacks.compendium.model.ExpandedItem;
import dev.badgersnacks.compendium.model.GenericVariantTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates one template against every base item and builds the items it generates, in base item order.
 * Holds no mutable state, so worker threads share one instance.
 */
final class TemplateExpander {

    private final MatchEngine matchEngine;
    private final NameComposer nameComposer;
    private final BlobMerger blobMerger;

    TemplateExpander(MatchEngine matchEngine, NameComposer nameComposer, BlobMerger blobMerger) {
        this.matchEngine = Objects.requireNonNull(matchEngine, "matchEngine");
        this.nameComposer = Objects.requireNonNull(nameComposer, "nameComposer");
        this.blobMerger = Objects.requireNonNull(blobMerger, "blobMerger");
    }

    List<ExpandedItem> expand(GenericVariantTemplate template, List<BaseItem> baseItems) {
        String source = template.effectiveSource();
        String inheritedRarity = template.inherits().rarity();
        List<ExpandedItem> generated = new ArrayList<>();
        for (BaseItem base : baseItems) {
            if (!matchEngine.itemMatchesTemplate(base, template)) {
                continue;
            }
            String name = nameComposer.computeName(template.inherits(), base.name());
            ObjectNode data = blobMerger.merge(base, template, name);
            String rarity = inheritedRarity != null ? inheritedRarity : data.path("rarity").asText(null);
            generated.add(new ExpandedItem(name, source, base.typeCode(), rarity, data, template.name(),
                    base.reference()));
        }
        return generated;
    }
}
