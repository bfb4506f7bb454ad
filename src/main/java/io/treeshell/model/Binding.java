package io.treeshell.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reference from a callable node to the external function it invokes.
 */
public record Binding(
        String functionName,
        boolean async,
        Map<String, ArgSpec> argsSchema
) {
    public Binding {
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("binding requires function_name");
        }
        argsSchema = Collections.unmodifiableMap(new LinkedHashMap<>(argsSchema == null ? Map.of() : argsSchema));
    }
}
