package io.treeshell.model;

import java.util.List;

/**
 * A named subtree. {@code rootId} always equals {@code name}; {@code parent}, when set,
 * names a menu node in another family that receives the root as a child.
 */
public record Family(
        String name,
        String parent,
        String domain,
        String description,
        ValidationWarning.Layer source,
        List<String> nodeIds
) {
    public Family {
        nodeIds = List.copyOf(nodeIds == null ? List.of() : nodeIds);
    }

    public String rootId() {
        return name;
    }
}
