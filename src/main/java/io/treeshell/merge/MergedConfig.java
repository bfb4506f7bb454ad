package io.treeshell.merge;

import io.treeshell.model.Family;
import io.treeshell.model.Shortcut;
import io.treeshell.model.ValidationWarning;
import io.treeshell.nav.NavConfig;
import io.treeshell.store.NodeStore;
import io.treeshell.zone.ZoneDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one merge pass. Immutable; a reload produces a new instance.
 */
public record MergedConfig(
        NodeStore nodes,
        Map<String, Family> families,
        Map<String, Shortcut> shortcuts,
        Map<String, ZoneDefinition> zones,
        NavConfig navConfig,
        List<ValidationWarning> warnings
) {
    public MergedConfig {
        families = Collections.unmodifiableMap(new LinkedHashMap<>(families));
        shortcuts = Collections.unmodifiableMap(new LinkedHashMap<>(shortcuts));
        zones = Collections.unmodifiableMap(new LinkedHashMap<>(zones));
        warnings = List.copyOf(warnings);
    }
}
