package io.treeshell.runtime;

import io.treeshell.config.ShellSettings;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.merge.ConfigMergeEngine;
import io.treeshell.merge.MergedConfig;
import io.treeshell.model.ValidationWarning;
import io.treeshell.nav.NavAssigner;
import io.treeshell.nav.NavMap;
import io.treeshell.resolve.AddressResolver;
import io.treeshell.zone.ZoneGrouper;
import io.treeshell.zone.ZoneIndex;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure build of a {@link ShellSnapshot}: merge, nav assignment, zone grouping, resolver.
 */
public final class SnapshotBuilder {
    private final ConfigMergeEngine mergeEngine;
    private final NavAssigner navAssigner;
    private final ZoneGrouper zoneGrouper;

    public SnapshotBuilder() {
        this(new ConfigMergeEngine(), new NavAssigner(), new ZoneGrouper());
    }

    public SnapshotBuilder(ConfigMergeEngine mergeEngine, NavAssigner navAssigner, ZoneGrouper zoneGrouper) {
        this.mergeEngine = mergeEngine;
        this.navAssigner = navAssigner;
        this.zoneGrouper = zoneGrouper;
    }

    /**
     * @throws io.treeshell.nav.NavConflictException when the nav configuration is rejected
     */
    public ShellSnapshot build(TreeShellConfig config, ShellSettings settings, long generation) {
        MergedConfig merged = mergeEngine.merge(config);
        List<ValidationWarning> warnings = new ArrayList<>(merged.warnings());

        Set<String> navigable = new LinkedHashSet<>();
        for (String family : merged.families().keySet()) {
            if (merged.nodes().contains(family)) {
                navigable.add(family);
            }
        }
        NavMap nav = navAssigner.assign(merged.navConfig(), navigable, warnings::add);
        ZoneIndex zones = zoneGrouper.group(
                merged.zones().values(),
                AddressResolver.withoutZonesOrAliases(merged.nodes(), nav),
                warnings::add
        );
        AddressResolver resolver = new AddressResolver(
                merged.nodes(), nav, zones, merged.shortcuts(), settings.maxAliasDepth());
        return new ShellSnapshot(generation, merged, nav, zones, resolver, warnings, Instant.now().toEpochMilli());
    }
}
