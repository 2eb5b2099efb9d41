package dev.badgersnacks.compendium.variants;

import dev.badgersnacks.compendium.model.VariantInherits;
import org.junit.jupiter.api.Test;

import static dev.badgersnacks.compendium.CompendiumFixtures.json;
import static dev.badgersnacks.compendium.CompendiumFixtures.template;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NameComposerTest {

    private final NameComposer composer = new NameComposer();

    @Test
    void prefixOnly() {
        assertEquals("+1 Shortsword", composer.computeName(inherits("+1 ", null, null), "Shortsword"));
    }

    @Test
    void suffixOnly() {
        assertEquals("Arrow of Slaying", composer.computeName(inherits(null, " of Slaying", null), "Arrow"));
    }

    @Test
    void prefixWithRemovedFragment() {
        assertEquals("Barding, Chain Mail",
                composer.computeName(inherits("Barding, ", null, " Barding"), "Chain Mail Barding"));
    }

    @Test
    void bardingDropsArmorFromBaseName() {
        assertEquals("Barding, Chain Mail",
                composer.computeName(inherits("Barding, ", null, " Armor"), "Chain Mail Armor"));
    }

    @Test
    void removesOnlyFirstOccurrence() {
        assertEquals("Big Axe Axe", composer.computeName(inherits("Big ", null, "Axe "), "Axe Axe Axe"));
    }

    @Test
    void missingFragmentLeavesNameAlone() {
        assertEquals("Mithral Breastplate",
                composer.computeName(inherits("Mithral ", null, " Barding"), "Breastplate"));
    }

    @Test
    void validateRejectsTemplateWithoutPrefixOrSuffix() {
        TemplateValidationException error = assertThrows(TemplateValidationException.class, () ->
                composer.validate(template("""
                        {"name": "Nameless", "requires": [{"weapon": true}], "inherits": {"source": "DMG"}}
                        """)));
        assertEquals("Nameless", error.templateName());
        assertDoesNotThrow(() -> composer.validate(template("""
                {"name": "Named", "requires": [{"weapon": true}], "inherits": {"nameSuffix": " of Light"}}
                """)));
    }

    private static VariantInherits inherits(String prefix, String suffix, String remove) {
        return new VariantInherits(prefix, suffix, remove, "DMG", null, json("{}"));
    }
}
