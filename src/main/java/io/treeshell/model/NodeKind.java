package io.treeshell.model;

public enum NodeKind {
    MENU("Menu"),
    CALLABLE("Callable");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static NodeKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("node type is required");
        }
        for (NodeKind value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + raw);
    }
}
