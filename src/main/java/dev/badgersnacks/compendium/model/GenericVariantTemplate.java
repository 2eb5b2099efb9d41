package dev.badgersnacks.compendium.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An abstract magic-item rule (e.g. "+1 Weapon") that expands into one concrete item per matching base item.
 *
 * @param source the template's own top-level source, used only when {@code inherits.source} is absent
 */
public record GenericVariantTemplate(
        String name,
        String source,
        List<Requirement> requires,
        Map<String, RequirementValue> excludes,
        VariantInherits inherits,
        ObjectNode raw
) {

    public GenericVariantTemplate {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(raw, "raw");
        requires = requires == null ? List.of() : List.copyOf(requires);
        excludes = excludes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(excludes));
        inherits = inherits == null ? VariantInherits.empty() : inherits;
    }

    /**
     * Source stamped on generated items: {@code inherits.source}, falling back to the template's own source.
     * May be {@code null} for malformed templates.
     */
    public String effectiveSource() {
        if (inherits.source() != null && !inherits.source().isBlank()) {
            return inherits.source();
        }
        return source == null || source.isBlank() ? null : source;
    }

    /**
     * Exclusion keys whose value could not be decoded; they never exclude anything.
     */
    public List<String> unsupportedExcludes() {
        return excludes.entrySet().stream()
                .filter(entry -> entry.getValue() instanceof RequirementValue.Unsupported)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public String displayId() {
        String effective = effectiveSource();
        return effective == null ? name : name + "|" + effective;
    }
}
