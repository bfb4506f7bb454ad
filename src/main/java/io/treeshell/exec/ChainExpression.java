package io.treeshell.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code addr1 [argsJson] -> addr2 [argsJson] -> ...}. Arrows inside JSON strings or objects
 * do not split steps.
 */
public final class ChainExpression {
    public static final String ARROW = "->";

    private ChainExpression() {
    }

    public static List<Step> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("chain expression is empty");
        }
        List<String> parts = splitSteps(expression);
        List<Step> steps = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i).trim();
            if (part.isEmpty()) {
                throw new IllegalArgumentException("chain step " + (i + 1) + " is empty");
            }
            int space = indexOfWhitespace(part);
            String address = space < 0 ? part : part.substring(0, space);
            String args = space < 0 ? "" : part.substring(space + 1).trim();
            steps.add(new Step(i + 1, address, args));
        }
        return steps;
    }

    /**
     * Parses step arguments; blank text is an empty object.
     *
     * @throws ExecutionException of kind ARG_VALIDATION when the text is not a JSON object
     */
    public static ObjectNode parseArgs(String address, String argsText) {
        if (argsText == null || argsText.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        JsonNode tree;
        try {
            tree = Jsons.mapper().readTree(argsText);
        } catch (JsonProcessingException e) {
            throw new ExecutionException(ExecutionException.Kind.ARG_VALIDATION,
                    address + ": arguments are not valid JSON: " + e.getOriginalMessage());
        }
        if (tree == null || !tree.isObject()) {
            throw new ExecutionException(ExecutionException.Kind.ARG_VALIDATION,
                    address + ": arguments must be a JSON object");
        }
        return (ObjectNode) tree;
    }

    private static List<String> splitSteps(String expression) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < expression.length(); i++) {
            char ch = expression.charAt(i);
            if (inString) {
                current.append(ch);
                if (ch == '\\' && i + 1 < expression.length()) {
                    current.append(expression.charAt(++i));
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{' || ch == '[') {
                depth++;
            } else if (ch == '}' || ch == ']') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && expression.startsWith(ARROW, i)) {
                out.add(current.toString());
                current.setLength(0);
                i += ARROW.length() - 1;
                continue;
            }
            current.append(ch);
        }
        out.add(current.toString());
        return out;
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    public record Step(int index, String address, String argsText) {
    }
}
