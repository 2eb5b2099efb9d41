package dev.badgersnacks.compendium.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Catalog identity of an item: {@code (name, source)} is unique across the item table.
 */
public record ItemKey(String name, String source) implements Comparable<ItemKey> {

    private static final Comparator<ItemKey> ORDER = Comparator
            .comparing(ItemKey::name)
            .thenComparing(ItemKey::source);

    public ItemKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
    }

    @Override
    public int compareTo(ItemKey other) {
        return ORDER.compare(this, other);
    }

    public String asString() {
        return name + "|" + source;
    }
}
