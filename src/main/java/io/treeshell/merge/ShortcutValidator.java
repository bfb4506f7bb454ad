package io.treeshell.merge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.load.EntryValidator;
import io.treeshell.load.InvalidEntryException;
import io.treeshell.model.Node;
import io.treeshell.model.Shortcut;
import io.treeshell.util.Jsons;

import java.util.Locale;
import java.util.function.Consumer;

public final class ShortcutValidator implements EntryValidator<Shortcut> {

    @Override
    public Shortcut validate(String alias, ObjectNode raw, Consumer<String> notes) throws InvalidEntryException {
        if (alias == null || alias.isBlank() || alias.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidEntryException("shortcut alias must be a single token");
        }
        if (Node.isUniversalSelector(alias)) {
            throw new InvalidEntryException("shortcut alias may not be a universal selector");
        }
        Shortcut.Type type;
        try {
            type = Shortcut.Type.fromString(raw.path("type").asText(null));
        } catch (IllegalArgumentException e) {
            throw new InvalidEntryException("unknown shortcut type '" + raw.path("type").asText() + "'");
        }
        String description = raw.path("description").asText("");
        if (type == Shortcut.Type.CHAIN) {
            String template = raw.path("template").asText("").trim();
            if (template.isEmpty()) {
                throw new InvalidEntryException("chain shortcut requires a 'template'");
            }
            return new Shortcut(alias, type, template, description);
        }
        String target = raw.path("coordinate").asText(raw.path("target").asText("")).trim();
        if (target.isEmpty()) {
            throw new InvalidEntryException("jump shortcut requires a 'coordinate'");
        }
        if (target.equals(alias)) {
            notes.accept("shortcut points at itself and will never resolve");
        }
        return new Shortcut(alias, type, target, description);
    }

    public static ObjectNode toTree(Shortcut shortcut) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("type", shortcut.type().name().toLowerCase(Locale.ROOT));
        node.put(shortcut.type() == Shortcut.Type.CHAIN ? "template" : "coordinate", shortcut.target());
        if (shortcut.description() != null && !shortcut.description().isBlank()) {
            node.put("description", shortcut.description());
        }
        return node;
    }
}
