package dev.badgersnacks.compendium.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.compendium.model.BaseItem;
import dev.badgersnacks.compendium.model.Capability;
import dev.badgersnacks.compendium.model.GenericVariantTemplate;
import dev.badgersnacks.compendium.model.Requirement;
import dev.badgersnacks.compendium.model.RequirementValue;
import dev.badgersnacks.compendium.model.VariantInherits;
import dev.badgersnacks.compendium.util.SourcedRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns already-parsed compendium JSON objects into typed base items and variant templates.
 *
 * <p>Every mixed-shape field is decoded here, once, so matching never has to inspect raw JSON shapes.
 * Objects without a usable name are skipped with a warning.
 */
public final class CompendiumDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompendiumDecoder.class);

    public List<BaseItem> decodeBaseItems(Iterable<JsonNode> nodes, String fallbackSource) {
        List<BaseItem> items = new ArrayList<>();
        for (JsonNode node : nodes) {
            decodeBaseItem(node, fallbackSource).ifPresent(items::add);
        }
        return items;
    }

    public List<GenericVariantTemplate> decodeTemplates(Iterable<JsonNode> nodes) {
        List<GenericVariantTemplate> templates = new ArrayList<>();
        for (JsonNode node : nodes) {
            decodeTemplate(node).ifPresent(templates::add);
        }
        return templates;
    }

    public Optional<BaseItem> decodeBaseItem(JsonNode node, String fallbackSource) {
        if (!(node instanceof ObjectNode object)) {
            LOGGER.warn("Skipping base item that is not a JSON object: {}", shapeOf(node));
            return Optional.empty();
        }
        String name = textValue(object.get("name"));
        if (name == null || name.isBlank()) {
            LOGGER.warn("Skipping base item without a name");
            return Optional.empty();
        }
        String source = textValue(object.get("source"));
        if (source == null || source.isBlank()) {
            source = fallbackSource;
        }
        if (source == null || source.isBlank()) {
            LOGGER.warn("Skipping base item '{}' without a source", name);
            return Optional.empty();
        }

        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (Capability capability : Capability.values()) {
            JsonNode flag = object.get(capability.jsonKey());
            if (flag != null && flag.isBoolean() && flag.booleanValue()) {
                capabilities.add(capability);
            }
        }

        JsonNode weightNode = object.get("weight");
        Double weight = weightNode != null && weightNode.isNumber() ? weightNode.doubleValue() : null;

        return Optional.of(new BaseItem(
                name,
                source,
                SourcedRef.strip(textValue(object.get("type"))),
                textValue(object.get("weaponCategory")),
                capabilities,
                textValue(object.get("dmg1")),
                textValue(object.get("dmgType")),
                weight,
                decodeProperties(object.get("property")),
                textValue(object.get("scfType")),
                object));
    }

    public Optional<GenericVariantTemplate> decodeTemplate(JsonNode node) {
        if (!(node instanceof ObjectNode object)) {
            LOGGER.warn("Skipping variant template that is not a JSON object: {}", shapeOf(node));
            return Optional.empty();
        }
        String name = textValue(object.get("name"));
        if (name == null || name.isBlank()) {
            LOGGER.warn("Skipping variant template without a name");
            return Optional.empty();
        }

        List<Requirement> requires = new ArrayList<>();
        JsonNode requiresNode = object.get("requires");
        if (requiresNode != null && requiresNode.isArray()) {
            for (JsonNode requirementNode : requiresNode) {
                requires.add(decodeRequirement(requirementNode));
            }
        } else if (requiresNode != null) {
            LOGGER.warn("Variant template '{}' has a non-array requires block ({})", name, shapeOf(requiresNode));
        }

        Map<String, RequirementValue> excludes = new LinkedHashMap<>();
        JsonNode excludesNode = object.get("excludes");
        if (excludesNode != null && excludesNode.isObject()) {
            excludesNode.fields().forEachRemaining(entry ->
                    excludes.put(entry.getKey(), RequirementValue.decode(entry.getValue())));
        } else if (excludesNode != null && !excludesNode.isNull()) {
            LOGGER.warn("Ignoring non-object excludes block on variant template '{}'", name);
        }

        JsonNode inheritsNode = object.get("inherits");
        VariantInherits inherits = inheritsNode instanceof ObjectNode inheritsObject
                ? decodeInherits(inheritsObject)
                : VariantInherits.empty();

        return Optional.of(new GenericVariantTemplate(
                name,
                textValue(object.get("source")),
                requires,
                excludes,
                inherits,
                object));
    }

    private Requirement decodeRequirement(JsonNode node) {
        if (!node.isObject()) {
            return Requirement.malformed(shapeOf(node));
        }
        Map<String, RequirementValue> conditions = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry ->
                conditions.put(entry.getKey(), RequirementValue.decode(entry.getValue())));
        return Requirement.of(conditions);
    }

    private VariantInherits decodeInherits(ObjectNode inherits) {
        return new VariantInherits(
                textValue(inherits.get("namePrefix")),
                textValue(inherits.get("nameSuffix")),
                textValue(inherits.get("nameRemove")),
                textValue(inherits.get("source")),
                textValue(inherits.get("rarity")),
                inherits);
    }

    private Set<String> decodeProperties(JsonNode node) {
        if (node == null || !node.isArray()) {
            return Set.of();
        }
        Set<String> properties = new LinkedHashSet<>();
        for (JsonNode property : node) {
            if (property.isTextual()) {
                properties.add(property.textValue());
            } else if (property.isObject()) {
                // newer data wraps tags as {"uid": "V|XPHB", "note": ...}
                String uid = textValue(property.get("uid"));
                if (uid != null) {
                    properties.add(uid);
                }
            }
        }
        return properties;
    }

    private static String shapeOf(JsonNode node) {
        return node == null ? "missing" : node.getNodeType().name().toLowerCase();
    }

    private static String textValue(JsonNode node) {
        return node != null && node.isTextual() ? node.textValue() : null;
    }
}
