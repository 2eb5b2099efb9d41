package dev.badgersnacks.compendium.variants;

import com.fasterxml.jackson.databind.JsonNode;
import dev.badgersnacks.compendium.model.BaseItem;
import dev.badgersnacks.compendium.model.GenericVariantTemplate;
import dev.badgersnacks.compendium.model.Requirement;
import dev.badgersnacks.compendium.model.RequirementValue;
import dev.badgersnacks.compendium.util.SourcedRef;

import java.util.Map;

/**
 * Decides whether a base item satisfies a template's {@code requires} and {@code excludes} rules.
 *
 * <p>Stateless and side-effect free, so a single instance is shared by every worker thread. Values of an
 * unsupported shape never match and never exclude.
 */
public final class MatchEngine {

    public boolean itemMatchesTemplate(BaseItem item, GenericVariantTemplate template) {
        boolean required = false;
        for (Requirement requirement : template.requires()) {
            if (requirementMatches(requirement, item)) {
                required = true;
                break;
            }
        }
        return required && !itemExcluded(item, template.excludes());
    }

    /**
     * Every condition of the requirement must hold for the item.
     */
    public boolean requirementMatches(Requirement requirement, BaseItem item) {
        if (requirement.isMalformed()) {
            return false;
        }
        for (Map.Entry<String, RequirementValue> condition : requirement.conditions().entrySet()) {
            if (!conditionMatches(condition.getKey(), condition.getValue(), item)) {
                return false;
            }
        }
        return true;
    }

    public boolean itemExcluded(BaseItem item, Map<String, RequirementValue> excludes) {
        for (Map.Entry<String, RequirementValue> exclusion : excludes.entrySet()) {
            String key = exclusion.getKey();
            RequirementValue value = exclusion.getValue();
            if (value instanceof RequirementValue.Flag flag) {
                if (flag.value() && item.flag(key)) {
                    return true;
                }
            } else if (value instanceof RequirementValue.Text text) {
                if (item.name().equals(text.value()) || textMatches(key, text.value(), item)) {
                    return true;
                }
            } else if (value instanceof RequirementValue.TextList list) {
                for (String candidate : list.values()) {
                    if (item.name().equals(candidate)
                            || item.hasProperty(candidate)
                            || textMatches(key, candidate, item)) {
                        return true;
                    }
                }
            } else if (value instanceof RequirementValue.Number number) {
                if (number.matches(item.raw().get(key))) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean conditionMatches(String key, RequirementValue expected, BaseItem item) {
        if (expected instanceof RequirementValue.Flag flag) {
            return item.flag(key) == flag.value();
        }
        if (expected instanceof RequirementValue.Text text) {
            return textMatches(key, text.value(), item);
        }
        if (expected instanceof RequirementValue.TextList list) {
            return list.values().stream().anyMatch(candidate -> textMatches(key, candidate, item));
        }
        if (expected instanceof RequirementValue.Number number) {
            return number.matches(item.raw().get(key));
        }
        return false;
    }

    private boolean textMatches(String key, String expected, BaseItem item) {
        switch (key) {
            case "type":
                return item.typeCode() != null && item.typeCode().equals(SourcedRef.strip(expected));
            case "property":
                return item.hasProperty(expected);
            case "name":
                return item.name().equals(expected);
            case "source":
                return item.source().equals(expected);
            case "weaponCategory":
                return expected.equals(item.weaponCategory());
            default:
                return rawFieldEquals(item.raw().get(key), expected);
        }
    }

    private boolean rawFieldEquals(JsonNode actual, String expected) {
        if (actual == null) {
            return false;
        }
        if (actual.isTextual()) {
            return expected.equals(actual.textValue());
        }
        if (actual.isArray()) {
            for (JsonNode element : actual) {
                if (element.isTextual() && expected.equals(element.textValue())) {
                    return true;
                }
            }
        }
        return false;
    }
}
