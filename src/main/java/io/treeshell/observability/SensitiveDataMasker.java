package io.treeshell.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.model.ArgSpec;
import io.treeshell.model.Binding;
import io.treeshell.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks callable arguments before they reach the audit log. Arguments a binding declares
 * {@code "sensitive": true} are masked whatever their name; any other key that names a
 * credential is masked at any depth.
 */
public final class SensitiveDataMasker {
    static final String MASK = "***";
    private static final Set<String> CREDENTIAL_WORDS = Set.of(
            "password", "passwd", "secret", "token", "api_key", "apikey", "credential"
    );

    private SensitiveDataMasker() {
    }

    public static ObjectNode maskArgs(Binding binding, ObjectNode args) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        if (args == null) {
            return out;
        }
        Map<String, ArgSpec> schema = binding == null ? Map.of() : binding.argsSchema();
        Iterator<Map.Entry<String, JsonNode>> it = args.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            ArgSpec spec = schema.get(entry.getKey());
            if ((spec != null && spec.sensitive()) || namesCredential(entry.getKey())) {
                out.put(entry.getKey(), MASK);
            } else {
                out.set(entry.getKey(), masked(entry.getValue()));
            }
        }
        return out;
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            input.fields().forEachRemaining(entry -> {
                if (namesCredential(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            });
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            input.forEach(value -> out.add(masked(value)));
            return out;
        }
        return input;
    }

    static boolean namesCredential(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return CREDENTIAL_WORDS.stream().anyMatch(lower::contains);
    }
}
