package io.treeshell.zone;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.load.EntryValidator;
import io.treeshell.load.InvalidEntryException;
import io.treeshell.model.ComboAddress;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;

public final class ZoneDefinitionValidator implements EntryValidator<ZoneDefinition> {
    private final Set<String> familyNames;

    public ZoneDefinitionValidator(Set<String> familyNames) {
        this.familyNames = Set.copyOf(familyNames);
    }

    @Override
    public ZoneDefinition validate(String name, ObjectNode raw, Consumer<String> notes) throws InvalidEntryException {
        if (name == null || name.isBlank() || name.contains(".") || name.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidEntryException("zone name must be a single path segment");
        }
        if (familyNames.contains(name)) {
            throw new InvalidEntryException("zone name collides with family '" + name + "'");
        }
        JsonNode tree = raw.get("zone_tree");
        if (tree == null || !tree.isArray()) {
            throw new InvalidEntryException("zone requires a 'zone_tree' array");
        }
        LinkedHashSet<String> members = new LinkedHashSet<>();
        for (JsonNode item : tree) {
            if (!item.isTextual() || item.asText().isBlank()) {
                notes.accept("zone member must be a non-empty string");
                continue;
            }
            String ref = item.asText().trim();
            if (ComboAddress.looksLikeCombo(ref)) {
                notes.accept("combo address '" + ref + "' cannot be a zone member");
                continue;
            }
            members.add(ref);
        }
        return new ZoneDefinition(name, raw.path("description").asText(""), new ArrayList<>(members));
    }
}
