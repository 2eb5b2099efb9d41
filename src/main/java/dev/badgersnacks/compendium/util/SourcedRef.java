package dev.badgersnacks.compendium.util;

import java.util.Objects;

/**
 * Compendium reference of the form {@code value|SOURCE} (e.g. {@code M|XPHB} or {@code 2H|XPHB}).
 * The source part is optional.
 */
public record SourcedRef(String value, String source) {
    public SourcedRef {
        Objects.requireNonNull(value, "value");
    }

    public static SourcedRef parse(String ref) {
        Objects.requireNonNull(ref, "ref");
        int idx = ref.indexOf('|');
        if (idx < 0) {
            return new SourcedRef(ref, null);
        }
        String source = ref.substring(idx + 1);
        return new SourcedRef(ref.substring(0, idx), source.isEmpty() ? null : source);
    }

    /**
     * Returns the reference without its {@code |SOURCE} suffix, or {@code null} for a null input.
     */
    public static String strip(String ref) {
        if (ref == null) {
            return null;
        }
        return parse(ref).value();
    }

    public boolean hasSource() {
        return source != null;
    }

    public String asString() {
        return source == null ? value : value + "|" + source;
    }
}
