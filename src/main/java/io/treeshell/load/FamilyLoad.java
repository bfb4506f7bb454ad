package io.treeshell.load;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.model.Family;
import io.treeshell.model.ValidationWarning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of loading one family. {@code family} is {@code null} when neither layer yielded a
 * usable definition; {@code nodes} keeps the raw validated entries so later layers can patch them.
 */
public record FamilyLoad(
        Family family,
        Map<String, ObjectNode> nodes,
        List<ValidationWarning> warnings
) {
    public FamilyLoad {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes == null ? Map.of() : nodes));
        warnings = List.copyOf(warnings == null ? List.of() : warnings);
    }

    public boolean loaded() {
        return family != null;
    }
}
