package dev.badgersnacks.compendium.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed value of a {@code requires} or {@code excludes} entry. Compendium data mixes booleans, strings and
 * string lists under the same keys, so every value is decoded once into one of these shapes.
 */
public interface RequirementValue {

    /**
     * Decodes a raw JSON value. Shapes the matcher cannot evaluate become {@link Unsupported}.
     */
    static RequirementValue decode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new Unsupported("null");
        }
        if (node.isBoolean()) {
            return new Flag(node.booleanValue());
        }
        if (node.isTextual()) {
            return new Text(node.textValue());
        }
        if (node.isNumber()) {
            return new Number(node.decimalValue());
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode element : node) {
                if (!element.isTextual()) {
                    return new Unsupported("array containing " + element.getNodeType().name().toLowerCase());
                }
                values.add(element.textValue());
            }
            return new TextList(values);
        }
        return new Unsupported(node.getNodeType().name().toLowerCase());
    }

    record Flag(boolean value) implements RequirementValue {
    }

    record Text(String value) implements RequirementValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    record Number(BigDecimal value) implements RequirementValue {
        public Number {
            Objects.requireNonNull(value, "value");
        }

        public boolean matches(JsonNode node) {
            return node != null && node.isNumber() && node.decimalValue().compareTo(value) == 0;
        }
    }

    record TextList(List<String> values) implements RequirementValue {
        public TextList {
            values = List.copyOf(values);
        }
    }

    record Unsupported(String shape) implements RequirementValue {
    }
}
