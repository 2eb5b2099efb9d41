package dev.badgersnacks.compendium.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One entry of a template's {@code requires} list. Every condition must hold (AND); a template matches when
 * any of its requirements does (OR).
 *
 * <p>{@code malformedShape} is set when the entry was not a JSON object at all; such a requirement never
 * matches.
 */
public record Requirement(Map<String, RequirementValue> conditions, String malformedShape) {

    public Requirement {
        conditions = conditions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
    }

    public static Requirement of(Map<String, RequirementValue> conditions) {
        return new Requirement(conditions, null);
    }

    public static Requirement malformed(String shape) {
        return new Requirement(Map.of(), shape);
    }

    public boolean isMalformed() {
        return malformedShape != null;
    }

    /**
     * A requirement can be evaluated when it is an object whose values all decoded to a supported shape.
     */
    public boolean isEvaluable() {
        return !isMalformed() && unsupportedKeys().isEmpty();
    }

    public List<String> unsupportedKeys() {
        return conditions.entrySet().stream()
                .filter(entry -> entry.getValue() instanceof RequirementValue.Unsupported)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
