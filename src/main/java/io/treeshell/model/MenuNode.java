package io.treeshell.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record MenuNode(
        String id,
        String label,
        String description,
        Map<String, String> options
) implements Node {
    public MenuNode {
        Objects.requireNonNull(id, "id");
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("menu node requires a label: " + id);
        }
        description = description == null ? "" : description;
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options == null ? Map.of() : options));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MENU;
    }

    public MenuNode withOption(String selector, String childId) {
        LinkedHashMap<String, String> next = new LinkedHashMap<>(options);
        next.put(selector, childId);
        return new MenuNode(id, label, description, next);
    }

    public MenuNode withoutSelectors(Set<String> selectors) {
        LinkedHashMap<String, String> next = new LinkedHashMap<>(options);
        next.keySet().removeAll(selectors);
        return new MenuNode(id, label, description, next);
    }
}
