package dev.badgersnacks.compendium.variants;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static dev.badgersnacks.compendium.CompendiumFixtures.json;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TemplateVariableResolverTest {

    private final TemplateVariableResolver resolver = new TemplateVariableResolver();

    @Test
    void resolvesFieldsInNestedEntries() {
        ObjectNode item = json("""
                {
                  "name": "+2 Longsword",
                  "bonusWeapon": "+2",
                  "dmgType": "S",
                  "entries": [
                    "You have a {=bonusWeapon} bonus to attack and damage rolls made with this magic weapon.",
                    {"type": "entries", "entries": ["It deals {=dmgType} damage."]}
                  ]
                }
                """);
        resolver.resolve(item, "Longsword");

        assertEquals("You have a +2 bonus to attack and damage rolls made with this magic weapon.",
                item.path("entries").get(0).asText());
        assertEquals("It deals Slashing damage.", item.path("entries").get(1).path("entries").get(0).asText());
        assertEquals("S", item.path("dmgType").asText());
    }

    @Test
    void damageTypeExpandsToCapitalisedNameWithLowerCaseForm() {
        ObjectNode item = json("""
                {"dmgType": "P", "entries": ["{=dmgType} or {=dmgType/l}"]}
                """);
        resolver.resolve(item, "Spear");
        assertEquals("Piercing or piercing", item.path("entries").get(0).asText());
    }

    @Test
    void unknownDamageCodeIsKeptAsWritten() {
        ObjectNode item = json("{\"dmgType\": \"Z\", \"entries\": [\"{=dmgType} damage\"]}");
        resolver.resolve(item, "Oddity");
        assertEquals("Z damage", item.path("entries").get(0).asText());
    }

    @Test
    void baseNameModifiers() {
        Map<String, String> lookup = Map.of();
        assertEquals("Arrows", resolver.resolveText("{=baseName}", lookup, "Arrows"));
        assertEquals("arrows", resolver.resolveText("{=baseName/l}", lookup, "Arrows"));
        assertEquals("an", resolver.resolveText("{=baseName/a}", lookup, "Arrows"));
        assertEquals("A", resolver.resolveText("{=baseName/at}", lookup, "Longbow"));
    }

    @Test
    void baseNameDropsParentheticalQuantity() {
        ObjectNode item = json("{\"entries\": [\"Each of these {=baseName/l} glows.\"]}");
        resolver.resolve(item, "Arrows (20)");
        assertEquals("Each of these arrows glows.", item.path("entries").get(0).asText());
    }

    @Test
    void numbersAndLowerCaseModifier() {
        Map<String, String> lookup = Map.of("charges", "3", "rarity", "Rare");
        assertEquals("3 charges, rare", resolver.resolveText("{=charges} charges, {=rarity/l}", lookup, null));
    }

    @Test
    void unknownPlaceholdersStayAsWritten() {
        assertEquals("{=missing} and {=baseName/x}",
                resolver.resolveText("{=missing} and {=baseName/x}", Map.of(), "Club"));
    }
}
