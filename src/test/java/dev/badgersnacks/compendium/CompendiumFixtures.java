package dev.badgersnacks.compendium;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.badgersnacks.compendium.decode.CompendiumDecoder;
import dev.badgersnacks.compendium.model.BaseItem;
import dev.badgersnacks.compendium.model.GenericVariantTemplate;

import java.io.UncheckedIOException;

/**
 * Small JSON helpers shared by the tests.
 */
public final class CompendiumFixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();
    private static final CompendiumDecoder DECODER = new CompendiumDecoder();

    private CompendiumFixtures() {
    }

    public static ObjectNode json(String text) {
        try {
            return (ObjectNode) MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode node(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static BaseItem baseItem(String text) {
        return DECODER.decodeBaseItem(json(text), "PHB").orElseThrow();
    }

    public static GenericVariantTemplate template(String text) {
        return DECODER.decodeTemplate(json(text)).orElseThrow();
    }

    public static BaseItem weapon(String name, String type, String category) {
        return baseItem("{\"name\":\"" + name + "\",\"source\":\"PHB\",\"type\":\"" + type
                + "\",\"weaponCategory\":\"" + category + "\",\"weapon\":true}");
    }
}
