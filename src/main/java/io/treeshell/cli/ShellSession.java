package io.treeshell.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.treeshell.exec.ChainExpression;
import io.treeshell.exec.VariableSubstitution;
import io.treeshell.util.Jsons;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Per-session state of a command processor: named variables fed into jump and chain
 * arguments, and the history of executed callables that pathways are saved from.
 */
public final class ShellSession {
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, JsonNode> variables = new LinkedHashMap<>();
    private final List<HistoryEntry> history = new ArrayList<>();

    /**
     * Stores {@code valueText} as JSON when it parses, otherwise as a string.
     */
    JsonNode set(String name, String valueText) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("variable name must match " + NAME.pattern() + ": " + name);
        }
        JsonNode value;
        try {
            value = valueText == null || valueText.isBlank()
                    ? TextNode.valueOf("")
                    : Jsons.mapper().readTree(valueText);
        } catch (JsonProcessingException e) {
            value = TextNode.valueOf(valueText.trim());
        }
        variables.put(name, value);
        return value;
    }

    JsonNode get(String name) {
        JsonNode value = variables.get(name);
        if (value == null) {
            throw new IllegalArgumentException("variable '" + name + "' is not set");
        }
        return value;
    }

    Map<String, JsonNode> variables() {
        return Collections.unmodifiableMap(variables);
    }

    void recordExecution(String nodeId, ObjectNode args, JsonNode result) {
        history.add(new HistoryEntry(history.size(), Instant.now().toString(), nodeId,
                args == null ? Jsons.mapper().createObjectNode() : args.deepCopy(), result));
        if (result != null) {
            variables.put(VariableSubstitution.LAST_RESULT, result);
        }
    }

    List<HistoryEntry> history() {
        return List.copyOf(history);
    }

    /**
     * Chain expression replaying the selected history steps in order.
     *
     * @param selection blank for all steps, {@code a-b} for a range or {@code a,b,c}; brackets allowed
     */
    String pathway(String selection) {
        if (history.isEmpty()) {
            throw new IllegalArgumentException("no executions recorded in this session");
        }
        List<Integer> ids = parseSelection(selection);
        List<String> steps = new ArrayList<>();
        for (int id : ids) {
            if (id < 0 || id >= history.size()) {
                throw new IllegalArgumentException("history has steps 0-" + (history.size() - 1) + "; no step " + id);
            }
            HistoryEntry entry = history.get(id);
            steps.add(entry.nodeId() + " " + entry.args().toString());
        }
        return String.join(" " + ChainExpression.ARROW + " ", steps);
    }

    private List<Integer> parseSelection(String selection) {
        String text = selection == null ? "" : selection.trim();
        if (text.startsWith("[") && text.endsWith("]")) {
            text = text.substring(1, text.length() - 1).trim();
        }
        List<Integer> ids = new ArrayList<>();
        try {
            if (text.isEmpty()) {
                for (int i = 0; i < history.size(); i++) {
                    ids.add(i);
                }
            } else if (text.contains("-") && !text.contains(",")) {
                String[] bounds = text.split("-", 2);
                int from = Integer.parseInt(bounds[0].trim());
                int to = Integer.parseInt(bounds[1].trim());
                for (int i = from; i <= to; i++) {
                    ids.add(i);
                }
            } else {
                ids.addAll(Pattern.compile(",").splitAsStream(text)
                        .map(String::trim)
                        .map(Integer::parseInt)
                        .collect(Collectors.toList()));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("step selection must be 0,1,2 or 0-3: " + selection, e);
        }
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("step selection is empty: " + selection);
        }
        return ids;
    }

    public record HistoryEntry(int stepId, String timestamp, String nodeId, ObjectNode args, JsonNode result) {
    }
}
