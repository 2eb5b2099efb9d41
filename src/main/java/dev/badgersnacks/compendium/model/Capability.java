package dev.badgersnacks.compendium.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Boolean capability flags a base item can carry, keyed by their compendium JSON field name.
 */
public enum Capability {
    WEAPON("weapon"),
    ARMOR("armor"),
    SWORD("sword"),
    AXE("axe"),
    BOW("bow"),
    CROSSBOW("crossbow"),
    SPEAR("spear"),
    POLEARM("polearm"),
    ARROW("arrow"),
    BOLT("bolt"),
    NET("net"),
    DAGGER("dagger"),
    MACE("mace"),
    HAMMER("hammer"),
    LANCE("lance"),
    RAPIER("rapier"),
    STAFF("staff"),
    CLUB("club"),
    FIREARM("firearm"),
    BULLET_FIREARM("bulletFirearm"),
    CELL_ENERGY("cellEnergy"),
    NEEDLE_BLOWGUN("needleBlowgun"),
    BULLET_SLING("bulletSling");

    private static final Map<String, Capability> BY_KEY = new HashMap<>();

    static {
        for (Capability capability : values()) {
            BY_KEY.put(capability.jsonKey, capability);
        }
    }

    private final String jsonKey;

    Capability(String jsonKey) {
        this.jsonKey = jsonKey;
    }

    public String jsonKey() {
        return jsonKey;
    }

    public static Optional<Capability> fromKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }
}
