package io.treeshell.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

public record CallableResult(
        boolean success,
        JsonNode output,
        String error
) {
    public static CallableResult ok(JsonNode output) {
        return new CallableResult(true, output, null);
    }

    public static CallableResult ok(String output) {
        return new CallableResult(true, TextNode.valueOf(output), null);
    }

    public static CallableResult fail(String error) {
        return new CallableResult(false, null, error);
    }
}
