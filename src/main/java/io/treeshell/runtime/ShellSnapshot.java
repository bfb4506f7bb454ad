package io.treeshell.runtime;

import io.treeshell.merge.MergedConfig;
import io.treeshell.model.ValidationWarning;
import io.treeshell.nav.NavMap;
import io.treeshell.resolve.AddressResolver;
import io.treeshell.store.NodeStore;
import io.treeshell.zone.ZoneIndex;

import java.util.List;

/**
 * Everything one merge pass produced. Immutable; commands read a single snapshot from start to
 * finish even if a reload swaps in a newer one meanwhile.
 */
public record ShellSnapshot(
        long generation,
        MergedConfig config,
        NavMap nav,
        ZoneIndex zones,
        AddressResolver resolver,
        List<ValidationWarning> warnings,
        long builtAtMs
) {
    public ShellSnapshot {
        warnings = List.copyOf(warnings);
    }

    public NodeStore nodes() {
        return config.nodes();
    }
}
