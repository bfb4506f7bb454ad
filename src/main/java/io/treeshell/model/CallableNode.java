package io.treeshell.model;

import java.util.Map;
import java.util.Objects;

public record CallableNode(
        String id,
        String label,
        String description,
        Binding binding
) implements Node {
    public CallableNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(binding, "binding");
        label = label == null || label.isBlank() ? Node.leafOf(id) : label;
        description = description == null ? "" : description;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALLABLE;
    }

    @Override
    public Map<String, String> options() {
        return Map.of();
    }
}
