package dev.badgersnacks.compendium.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Character classes an item's attunement can be restricted to, as named in a {@code reqAttune} text such as
 * {@code "by a cleric or paladin"}.
 */
public enum AttunementClass {
    ARTIFICER,
    BARBARIAN,
    BARD,
    CLERIC,
    DRUID,
    FIGHTER,
    MONK,
    PALADIN,
    RANGER,
    ROGUE,
    SORCERER,
    WARLOCK,
    WIZARD;

    private final String className = name().toLowerCase(Locale.ROOT);

    public String className() {
        return className;
    }

    /**
     * Classes mentioned anywhere in the text, case-insensitively, in declaration order. A {@code null} text or one
     * naming no class gives an empty list.
     */
    public static List<AttunementClass> mentionedIn(String reqAttune) {
        List<AttunementClass> classes = new ArrayList<>();
        if (reqAttune == null || reqAttune.isBlank()) {
            return classes;
        }
        String lower = reqAttune.toLowerCase(Locale.ROOT);
        for (AttunementClass candidate : values()) {
            if (lower.contains(candidate.className)) {
                classes.add(candidate);
            }
        }
        return classes;
    }
}
