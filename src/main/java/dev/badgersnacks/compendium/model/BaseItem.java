package dev.badgersnacks.compendium.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.compendium.util.SourcedRef;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A mundane equipment definition that variant templates expand against.
 *
 * <p>The indexed fields are decoded once from {@code raw}; the raw object is kept as-is so generated items
 * inherit every field of the base item. Callers must treat {@code raw} as read-only and deep copy it
 * before editing.
 */
public record BaseItem(
        String name,
        String source,
        String typeCode,
        String weaponCategory,
        Set<Capability> capabilities,
        String dmg1,
        String dmgType,
        Double weight,
        Set<String> properties,
        String scfType,
        ObjectNode raw
) {

    public BaseItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(raw, "raw");
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
        properties = properties == null ? Set.of() : Set.copyOf(properties);
    }

    public ItemKey key() {
        return new ItemKey(name, source);
    }

    /**
     * {@code name|source} reference recorded as provenance on generated items.
     */
    public String reference() {
        return name + "|" + source;
    }

    public boolean hasCapability(Capability capability) {
        return capabilities.contains(capability);
    }

    /**
     * Boolean flag lookup. Known capabilities come from the decoded set, anything else from a boolean field
     * of the raw object. Missing flags read as {@code false}.
     */
    public boolean flag(String key) {
        return Capability.fromKey(key)
                .map(capabilities::contains)
                .orElseGet(() -> {
                    JsonNode value = raw.get(key);
                    return value != null && value.isBoolean() && value.booleanValue();
                });
    }

    /**
     * Property tag check ignoring any {@code |SOURCE} suffix on either side.
     */
    public boolean hasProperty(String tag) {
        if (tag == null) {
            return false;
        }
        String wanted = SourcedRef.strip(tag);
        for (String property : properties) {
            if (wanted.equals(SourcedRef.strip(property))) {
                return true;
            }
        }
        return false;
    }
}
