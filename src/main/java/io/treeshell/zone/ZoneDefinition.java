package io.treeshell.zone;

import java.util.List;

/**
 * A named zone and its member references as written in configuration.
 */
public record ZoneDefinition(
        String name,
        String description,
        List<String> members
) {
    public ZoneDefinition {
        description = description == null ? "" : description;
        members = List.copyOf(members == null ? List.of() : members);
    }
}
