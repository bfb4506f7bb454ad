package io.treeshell.load;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.model.ArgSpec;
import io.treeshell.model.Binding;
import io.treeshell.model.CallableNode;
import io.treeshell.model.MenuNode;
import io.treeshell.model.Node;
import io.treeshell.model.NodeKind;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Schema check for node definitions. Accepts the flat layout
 * ({@code function_name}, {@code args_schema} next to {@code type}) and the nested
 * {@code binding} object.
 */
public final class NodeValidator implements EntryValidator<Node> {
    private final Set<String> families;

    /**
     * @param families family names a node id may start with
     */
    public NodeValidator(Set<String> families) {
        this.families = Set.copyOf(families);
    }

    @Override
    public Node validate(String id, ObjectNode raw, Consumer<String> notes) throws InvalidEntryException {
        checkId(id);
        if (!families.contains(Node.familyOf(id))) {
            throw new InvalidEntryException("node id does not belong to a loaded family");
        }
        String typeRaw = text(raw, "type", text(raw, "kind", null));
        if (typeRaw == null) {
            throw new InvalidEntryException("missing required field 'type'");
        }
        NodeKind kind;
        try {
            kind = NodeKind.fromString(typeRaw);
        } catch (IllegalArgumentException e) {
            throw new InvalidEntryException(e.getMessage());
        }
        String label = text(raw, "label", text(raw, "prompt", text(raw, "title", null)));
        String description = text(raw, "description", "");
        Map<String, String> options = readOptions(raw.get("options"), notes);
        if (kind == NodeKind.MENU) {
            if (label == null) {
                throw new InvalidEntryException("menu node requires 'prompt' or 'title'");
            }
            return new MenuNode(id, label, description, options);
        }
        if (!options.isEmpty()) {
            throw new InvalidEntryException("callable node may only expose the universal selectors 0 and 1");
        }
        JsonNode bindingNode = raw.get("binding");
        JsonNode source = bindingNode != null && bindingNode.isObject() ? bindingNode : raw;
        String functionName = text(source, "function_name", null);
        if (functionName == null) {
            throw new InvalidEntryException("callable node requires 'function_name'");
        }
        JsonNode schema = source.get("args_schema");
        if (schema == null || !schema.isObject()) {
            throw new InvalidEntryException("callable node requires an 'args_schema' object");
        }
        boolean async = source.path("is_async").asBoolean(false);
        return new CallableNode(id, label, description, new Binding(functionName, async, readSchema(schema)));
    }

    static void checkId(String id) throws InvalidEntryException {
        if (id == null || id.isBlank()) {
            throw new InvalidEntryException("node id is empty");
        }
        for (String segment : id.split("\\.", -1)) {
            if (segment.isEmpty()) {
                throw new InvalidEntryException("node id has an empty path segment");
            }
            if (Node.isUniversalSelector(segment)) {
                throw new InvalidEntryException("node id segment '" + segment + "' is a universal selector");
            }
            for (int i = 0; i < segment.length(); i++) {
                if (Character.isWhitespace(segment.charAt(i))) {
                    throw new InvalidEntryException("node id contains whitespace");
                }
            }
        }
    }

    private Map<String, String> readOptions(JsonNode raw, Consumer<String> notes) throws InvalidEntryException {
        Map<String, String> out = new LinkedHashMap<>();
        if (raw == null || raw.isNull()) {
            return out;
        }
        if (!raw.isObject()) {
            throw new InvalidEntryException("'options' must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> it = raw.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String selector = entry.getKey().trim();
            JsonNode target = entry.getValue();
            if (Node.isUniversalSelector(selector)) {
                notes.accept("option selector '" + selector + "' is reserved and was dropped");
                continue;
            }
            if (selector.isEmpty() || selector.contains(".")) {
                notes.accept("option selector '" + selector + "' is not a single path segment and was dropped");
                continue;
            }
            if (target == null || !target.isTextual() || target.asText().isBlank()) {
                throw new InvalidEntryException("option '" + selector + "' must reference a node id");
            }
            out.put(selector, target.asText().trim());
        }
        return out;
    }

    private Map<String, ArgSpec> readSchema(JsonNode schema) throws InvalidEntryException {
        Map<String, ArgSpec> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = schema.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode spec = entry.getValue();
            try {
                if (spec.isTextual()) {
                    out.put(entry.getKey(), new ArgSpec(ArgSpec.ArgType.fromString(spec.asText()), true));
                } else if (spec.isObject()) {
                    ArgSpec.ArgType type = ArgSpec.ArgType.fromString(spec.path("type").asText(null));
                    out.put(entry.getKey(), new ArgSpec(type, spec.path("required").asBoolean(true),
                            spec.path("sensitive").asBoolean(false)));
                } else {
                    throw new InvalidEntryException("argument '" + entry.getKey() + "' has an unsupported schema");
                }
            } catch (IllegalArgumentException e) {
                throw new InvalidEntryException("argument '" + entry.getKey() + "': " + e.getMessage());
            }
        }
        return out;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return fallback;
        }
        return value.asText().trim();
    }
}
