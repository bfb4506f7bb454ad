package io.treeshell.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.model.ValidationWarning;
import io.treeshell.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * User-layer customization record for one configuration kind.
 */
public record Customization(
        Map<String, ObjectNode> overrides,
        Map<String, ObjectNode> additions,
        List<String> exclusions
) {
    public static final String OVERRIDE_FIELD = "override_nodes";
    public static final String ADD_FIELD = "add_nodes";
    public static final String EXCLUDE_FIELD = "exclude_nodes";

    public Customization {
        overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides == null ? Map.of() : overrides));
        additions = Collections.unmodifiableMap(new LinkedHashMap<>(additions == null ? Map.of() : additions));
        exclusions = List.copyOf(exclusions == null ? List.of() : exclusions);
    }

    public static Customization empty() {
        return new Customization(Map.of(), Map.of(), List.of());
    }

    public boolean isEmpty() {
        return overrides.isEmpty() && additions.isEmpty() && exclusions.isEmpty();
    }

    /**
     * Reads a customization file. A missing file is an empty record; a broken file is a
     * warning and also an empty record. Broken individual entries are skipped with a warning.
     */
    public static Customization read(Path file, Consumer<ValidationWarning> warnings) {
        JsonNode root;
        try {
            root = Jsons.readTreeIfExists(file);
        } catch (IOException e) {
            warnings.accept(ValidationWarning.user(file.getFileName().toString(),
                    "customization file is not valid JSON: " + e.getMessage()));
            return empty();
        }
        if (root == null) {
            return empty();
        }
        if (!root.isObject()) {
            warnings.accept(ValidationWarning.user(file.getFileName().toString(),
                    "customization file must contain a JSON object"));
            return empty();
        }
        return fromTree((ObjectNode) root, warnings);
    }

    public static Customization fromTree(ObjectNode root, Consumer<ValidationWarning> warnings) {
        Map<String, ObjectNode> overrides = objectEntries(root.get(OVERRIDE_FIELD), OVERRIDE_FIELD, warnings);
        Map<String, ObjectNode> additions = objectEntries(root.get(ADD_FIELD), ADD_FIELD, warnings);
        LinkedHashSet<String> exclusions = new LinkedHashSet<>();
        JsonNode excludeNode = root.get(EXCLUDE_FIELD);
        if (excludeNode != null && !excludeNode.isNull()) {
            if (excludeNode.isArray()) {
                for (JsonNode item : excludeNode) {
                    if (item.isTextual() && !item.asText().isBlank()) {
                        exclusions.add(item.asText().trim());
                    } else {
                        warnings.accept(ValidationWarning.user(null, EXCLUDE_FIELD + " entries must be strings"));
                    }
                }
            } else {
                warnings.accept(ValidationWarning.user(null, EXCLUDE_FIELD + " must be an array"));
            }
        }
        return new Customization(overrides, additions, new ArrayList<>(exclusions));
    }

    /**
     * Serializable form, used when the shell itself writes a customization back.
     */
    public ObjectNode toTree() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        ObjectNode o = root.putObject(OVERRIDE_FIELD);
        overrides.forEach(o::set);
        ObjectNode a = root.putObject(ADD_FIELD);
        additions.forEach(a::set);
        exclusions.forEach(root.putArray(EXCLUDE_FIELD)::add);
        return root;
    }

    public Customization withAddition(String id, ObjectNode definition) {
        Map<String, ObjectNode> next = new LinkedHashMap<>(additions);
        next.put(id, definition);
        List<String> keptExclusions = new ArrayList<>(exclusions);
        keptExclusions.remove(id);
        return new Customization(overrides, next, keptExclusions);
    }

    private static Map<String, ObjectNode> objectEntries(JsonNode node, String field, Consumer<ValidationWarning> warnings) {
        Map<String, ObjectNode> out = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (!node.isObject()) {
            warnings.accept(ValidationWarning.user(null, field + " must be an object"));
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue().isObject()) {
                out.put(entry.getKey().trim(), ((ObjectNode) entry.getValue()).deepCopy());
            } else {
                warnings.accept(ValidationWarning.user(entry.getKey(), field + " entry must be an object"));
            }
        }
        return out;
    }
}
