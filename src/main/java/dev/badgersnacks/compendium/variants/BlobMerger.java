package dev.badgersnacks.compendium.variants;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.compendium.model.BaseItem;
import dev.badgersnacks.compendium.model.GenericVariantTemplate;
import dev.badgersnacks.compendium.util.SourcedRef;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the stored data blob of a generated item: the base item's full JSON with the template's inherited
 * fields laid over it.
 */
public final class BlobMerger {

    /**
     * Keys of the {@code inherits} block that are consumed while building the item and never copied into it.
     */
    static final Set<String> CONSUMED_KEYS = Set.of(
            "namePrefix",
            "nameSuffix",
            "nameRemove",
            "reprintedAs",
            "lootTables",
            "propertyAdd",
            "propertyRemove");

    static final String VARIANT_OF = "variantOf";
    static final String BASE_ITEM = "baseItem";
    private static final String BASE_ITEM_MARKER = "_isBaseItem";

    private final TemplateVariableResolver variableResolver;

    public BlobMerger() {
        this(new TemplateVariableResolver());
    }

    public BlobMerger(TemplateVariableResolver variableResolver) {
        this.variableResolver = Objects.requireNonNull(variableResolver, "variableResolver");
    }

    public ObjectNode merge(BaseItem base, GenericVariantTemplate template, String computedName) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(computedName, "computedName");

        ObjectNode merged = base.raw().deepCopy();
        ObjectNode inherits = template.inherits().raw();
        inherits.fields().forEachRemaining(field -> {
            if (!CONSUMED_KEYS.contains(field.getKey())) {
                merged.set(field.getKey(), field.getValue().deepCopy());
            }
        });
        String source = template.effectiveSource();
        if (source != null) {
            merged.put("source", source);
        }
        applyPropertyChanges(merged, inherits);

        merged.put("name", computedName);
        merged.put(VARIANT_OF, template.name());
        merged.put(BASE_ITEM, base.reference());
        merged.remove(BASE_ITEM_MARKER);

        variableResolver.resolve(merged, base.name());
        return merged;
    }

    private void applyPropertyChanges(ObjectNode merged, ObjectNode inherits) {
        JsonNode additions = inherits.get("propertyAdd");
        JsonNode removals = inherits.get("propertyRemove");
        if ((additions == null || !additions.isArray()) && (removals == null || !removals.isArray())) {
            return;
        }
        JsonNode existing = merged.get("property");
        ArrayNode properties = existing != null && existing.isArray()
                ? ((ArrayNode) existing).deepCopy()
                : JsonNodeFactory.instance.arrayNode();

        if (additions != null && additions.isArray()) {
            for (JsonNode addition : additions) {
                if (!contains(properties, addition)) {
                    properties.add(addition.deepCopy());
                }
            }
        }
        if (removals != null && removals.isArray()) {
            Set<String> removed = new HashSet<>();
            for (JsonNode removal : removals) {
                if (removal.isTextual()) {
                    removed.add(SourcedRef.strip(removal.textValue()));
                }
            }
            ArrayNode kept = JsonNodeFactory.instance.arrayNode();
            for (JsonNode property : properties) {
                String tag = propertyTag(property);
                if (tag == null || !removed.contains(SourcedRef.strip(tag))) {
                    kept.add(property);
                }
            }
            properties = kept;
        }

        if (properties.isEmpty()) {
            merged.remove("property");
        } else {
            merged.set("property", properties);
        }
    }

    private static boolean contains(ArrayNode properties, JsonNode candidate) {
        for (JsonNode property : properties) {
            if (property.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static String propertyTag(JsonNode property) {
        if (property.isTextual()) {
            return property.textValue();
        }
        JsonNode uid = property.get("uid");
        return uid != null && uid.isTextual() ? uid.textValue() : null;
    }
}
