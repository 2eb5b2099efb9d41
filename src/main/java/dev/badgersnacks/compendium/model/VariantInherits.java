package dev.badgersnacks.compendium.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * The {@code inherits} block of a variant template: naming directives plus the fields copied onto every
 * generated item. {@code raw} keeps the complete block, including passthrough fields such as
 * {@code bonusWeapon}, {@code bonusAc}, {@code entries} or {@code tier}.
 */
public record VariantInherits(
        String namePrefix,
        String nameSuffix,
        String nameRemove,
        String source,
        String rarity,
        ObjectNode raw
) {

    public VariantInherits {
        Objects.requireNonNull(raw, "raw");
    }

    public static VariantInherits empty() {
        return new VariantInherits(null, null, null, null, null, JsonNodeFactory.instance.objectNode());
    }

    public String prefixOrEmpty() {
        return namePrefix == null ? "" : namePrefix;
    }

    public String suffixOrEmpty() {
        return nameSuffix == null ? "" : nameSuffix;
    }

    public boolean hasNameRemove() {
        return nameRemove != null && !nameRemove.isEmpty();
    }
}
