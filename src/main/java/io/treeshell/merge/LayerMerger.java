package io.treeshell.merge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.load.EntryValidator;
import io.treeshell.load.InvalidEntryException;
import io.treeshell.model.ValidationWarning;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Applies one customization record over one system layer: override, then add, then exclude.
 * Pure: inputs are never mutated, and equal inputs give equal outputs in equal order.
 *
 * @param <T> typed entry value
 */
final class LayerMerger<T> {
    private final EntryValidator<T> validator;
    private final Consumer<ValidationWarning> warnings;
    private final boolean systemNotesReported;

    /**
     * @param systemNotesReported {@code true} when the system layer was already validated by its
     *                            loader, so its non-fatal notes are not reported a second time
     */
    LayerMerger(EntryValidator<T> validator, Consumer<ValidationWarning> warnings, boolean systemNotesReported) {
        this.validator = validator;
        this.warnings = warnings;
        this.systemNotesReported = systemNotesReported;
    }

    Map<String, T> merge(Map<String, ObjectNode> systemLayer, Customization customization) {
        Map<String, ObjectNode> raw = new LinkedHashMap<>();
        Map<String, T> typed = new LinkedHashMap<>();
        for (Map.Entry<String, ObjectNode> entry : systemLayer.entrySet()) {
            String id = entry.getKey();
            try {
                T value = validator.validate(id, entry.getValue(), note -> {
                    if (!systemNotesReported) {
                        warnings.accept(ValidationWarning.system(id, note));
                    }
                });
                raw.put(id, entry.getValue().deepCopy());
                typed.put(id, value);
            } catch (InvalidEntryException e) {
                warnings.accept(ValidationWarning.system(id, e.getMessage()));
            }
        }

        for (Map.Entry<String, ObjectNode> entry : customization.overrides().entrySet()) {
            String id = entry.getKey();
            ObjectNode base = raw.get(id);
            if (base == null) {
                warnings.accept(ValidationWarning.user(id, "override target does not exist; patch ignored"));
                continue;
            }
            ObjectNode patched = base.deepCopy();
            patched.setAll(entry.getValue().deepCopy());
            accept(id, patched, raw, typed, "override");
        }

        for (Map.Entry<String, ObjectNode> entry : customization.additions().entrySet()) {
            accept(entry.getKey(), entry.getValue().deepCopy(), raw, typed, "add");
        }

        for (String id : customization.exclusions()) {
            raw.remove(id);
            typed.remove(id);
        }
        return typed;
    }

    private void accept(String id, ObjectNode candidate, Map<String, ObjectNode> raw, Map<String, T> typed, String action) {
        try {
            T value = validator.validate(id, candidate, note -> warnings.accept(ValidationWarning.user(id, note)));
            raw.put(id, candidate);
            typed.put(id, value);
        } catch (InvalidEntryException e) {
            warnings.accept(ValidationWarning.user(id, action + " rejected: " + e.getMessage()));
        }
    }
}
