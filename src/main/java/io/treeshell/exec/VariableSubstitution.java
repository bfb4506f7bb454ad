package io.treeshell.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code "$name"} string values with the variable's JSON value and {@code {$name}}
 * inside longer strings with its text. Unknown names are left untouched.
 */
public final class VariableSubstitution {
    public static final String LAST_RESULT = "last_result";

    private static final Pattern WHOLE = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern EMBEDDED = Pattern.compile("\\{\\$([A-Za-z_][A-Za-z0-9_]*)}");

    private VariableSubstitution() {
    }

    public static String stepVariable(int stepIndex) {
        return "step" + stepIndex + "_result";
    }

    public static ObjectNode apply(ObjectNode args, Map<String, JsonNode> variables) {
        return (ObjectNode) substitute(args.deepCopy(), variables);
    }

    private static JsonNode substitute(JsonNode node, Map<String, JsonNode> variables) {
        if (node.isObject()) {
            ObjectNode obj = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                entry.setValue(substitute(entry.getValue(), variables));
            }
            return obj;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, substitute(array.get(i), variables));
            }
            return array;
        }
        if (!node.isTextual()) {
            return node;
        }
        String text = node.asText();
        Matcher whole = WHOLE.matcher(text);
        if (whole.matches() && variables.containsKey(whole.group(1))) {
            return variables.get(whole.group(1)).deepCopy();
        }
        Matcher embedded = EMBEDDED.matcher(text);
        StringBuilder sb = new StringBuilder();
        boolean changed = false;
        while (embedded.find()) {
            JsonNode value = variables.get(embedded.group(1));
            String replacement = value == null ? embedded.group() : (value.isTextual() ? value.asText() : value.toString());
            embedded.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            changed |= value != null;
        }
        embedded.appendTail(sb);
        return changed ? TextNode.valueOf(sb.toString()) : node;
    }
}
