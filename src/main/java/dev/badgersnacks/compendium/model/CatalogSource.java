package dev.badgersnacks.compendium.model;

import java.util.Objects;

/**
 * A source book known to the catalog. Disabled sources are skipped during import.
 */
public record CatalogSource(String code, String name, boolean enabled) {

    public CatalogSource {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(name, "name");
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
    }

    public static CatalogSource enabled(String code, String name) {
        return new CatalogSource(code, name, true);
    }
}
