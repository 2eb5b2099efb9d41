package dev.badgersnacks.compendium.variants;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {=key}} placeholders in variant text against the fields of the merged item.
 *
 * <p>Supported forms: {@code {=field}} for any top-level string or number field ({@code dmgType} expands to the
 * capitalised damage name), {@code {=field/l}} for its lower-case form, and {@code {=baseName/l}},
 * {@code {=baseName/a}}, {@code {=baseName/at}} for the base item name and its article. Unknown placeholders are left as written.
 */
public final class TemplateVariableResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{=([A-Za-z0-9_]+)(?:/([a-z]+))?}");
    private static final Map<String, String> DAMAGE_TYPES = Map.ofEntries(
            Map.entry("A", "Acid"),
            Map.entry("B", "Bludgeoning"),
            Map.entry("C", "Cold"),
            Map.entry("F", "Fire"),
            Map.entry("O", "Force"),
            Map.entry("L", "Lightning"),
            Map.entry("N", "Necrotic"),
            Map.entry("P", "Piercing"),
            Map.entry("I", "Poison"),
            Map.entry("Y", "Psychic"),
            Map.entry("R", "Radiant"),
            Map.entry("S", "Slashing"),
            Map.entry("T", "Thunder"));

    public void resolve(ObjectNode item, String baseName) {
        Map<String, String> lookup = buildLookup(item);
        String cleanBaseName = cleanBaseName(baseName);
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            field.setValue(resolveNode(field.getValue(), lookup, cleanBaseName));
        }
    }

    public String resolveText(String text, Map<String, String> lookup, String baseName) {
        if (text.indexOf("{=") < 0) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        return matcher.replaceAll(match -> {
            String replacement = replacementFor(match.group(1), match.group(2), lookup, baseName);
            return Matcher.quoteReplacement(replacement == null ? match.group() : replacement);
        });
    }

    private JsonNode resolveNode(JsonNode node, Map<String, String> lookup, String baseName) {
        if (node.isTextual()) {
            String resolved = resolveText(node.textValue(), lookup, baseName);
            return resolved.equals(node.textValue()) ? node : TextNode.valueOf(resolved);
        }
        if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                array.set(i, resolveNode(array.get(i), lookup, baseName));
            }
            return array;
        }
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                field.setValue(resolveNode(field.getValue(), lookup, baseName));
            }
            return object;
        }
        return node;
    }

    private String replacementFor(String key, String modifier, Map<String, String> lookup, String baseName) {
        if ("baseName".equals(key)) {
            if (baseName == null) {
                return null;
            }
            if (modifier == null) {
                return baseName;
            }
            switch (modifier) {
                case "l":
                    return baseName.toLowerCase(Locale.ROOT);
                case "a":
                    return article(baseName);
                case "at":
                    return "a".equals(article(baseName)) ? "A" : "An";
                default:
                    return null;
            }
        }
        String value = lookup.get(key);
        if (value == null) {
            return null;
        }
        if (modifier == null) {
            return value;
        }
        return "l".equals(modifier) ? value.toLowerCase(Locale.ROOT) : null;
    }

    private Map<String, String> buildLookup(ObjectNode item) {
        Map<String, String> lookup = new HashMap<>();
        item.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            if (value.isTextual()) {
                String text = value.textValue();
                if ("dmgType".equals(field.getKey())) {
                    text = DAMAGE_TYPES.getOrDefault(text, text);
                }
                lookup.put(field.getKey(), text);
            } else if (value.isNumber()) {
                lookup.put(field.getKey(), value.asText());
            }
        });
        return lookup;
    }

    // "Arrows (20)" reads as "arrows" in prose
    private static String cleanBaseName(String baseName) {
        if (baseName == null) {
            return null;
        }
        int paren = baseName.indexOf(" (");
        return paren > 0 ? baseName.substring(0, paren) : baseName;
    }

    private static String article(String word) {
        if (word.isEmpty()) {
            return "a";
        }
        char first = Character.toLowerCase(word.charAt(0));
        return "aeiou".indexOf(first) >= 0 ? "an" : "a";
    }
}
