package dev.badgersnacks.compendium.variants;

import dev.badgersnacks.compendium.model.GenericVariantTemplate;
import dev.badgersnacks.compendium.model.VariantInherits;

import java.util.Objects;

/**
 * Builds the display name of a generated item from the template's naming directives.
 */
public final class NameComposer {

    /**
     * Removes the first occurrence of {@code nameRemove} (case-sensitive) from the base name, then wraps the
     * result in the prefix and suffix.
     */
    public String computeName(VariantInherits inherits, String baseName) {
        Objects.requireNonNull(inherits, "inherits");
        Objects.requireNonNull(baseName, "baseName");
        String stem = baseName;
        if (inherits.hasNameRemove()) {
            int idx = stem.indexOf(inherits.nameRemove());
            if (idx >= 0) {
                stem = stem.substring(0, idx) + stem.substring(idx + inherits.nameRemove().length());
            }
        }
        return inherits.prefixOrEmpty() + stem + inherits.suffixOrEmpty();
    }

    /**
     * A template without prefix and suffix would reproduce its base items' names.
     */
    public void validate(GenericVariantTemplate template) throws TemplateValidationException {
        VariantInherits inherits = template.inherits();
        if (inherits.prefixOrEmpty().isEmpty() && inherits.suffixOrEmpty().isEmpty()) {
            throw new TemplateValidationException(template.name(), "neither namePrefix nor nameSuffix is set");
        }
    }
}
