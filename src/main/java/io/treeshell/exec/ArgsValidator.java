package io.treeshell.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.model.ArgSpec;
import io.treeshell.model.Binding;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

final class ArgsValidator {
    private ArgsValidator() {
    }

    /**
     * Checks required fields, types and unexpected names.
     *
     * @throws ExecutionException of kind {@link ExecutionException.Kind#ARG_VALIDATION}
     */
    static void validate(String nodeId, Binding binding, ObjectNode args) {
        List<String> problems = new ArrayList<>();
        Map<String, ArgSpec> schema = binding.argsSchema();
        for (Map.Entry<String, ArgSpec> entry : schema.entrySet()) {
            JsonNode value = args.get(entry.getKey());
            if (value == null || value.isNull()) {
                if (entry.getValue().required()) {
                    problems.add("missing required argument '" + entry.getKey() + "'");
                }
                continue;
            }
            if (!entry.getValue().type().accepts(value)) {
                problems.add("argument '" + entry.getKey() + "' must be " + entry.getValue().type().wireName());
            }
        }
        Iterator<String> names = args.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!schema.containsKey(name)) {
                problems.add("unexpected argument '" + name + "'");
            }
        }
        if (!problems.isEmpty()) {
            throw new ExecutionException(ExecutionException.Kind.ARG_VALIDATION,
                    nodeId + ": " + String.join("; ", problems));
        }
    }
}
