package io.treeshell.zone;

import io.treeshell.model.ValidationWarning;
import io.treeshell.resolve.AddressResolutionException;
import io.treeshell.resolve.AddressResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Resolves zone member references against the current node store. Unresolvable references are
 * dropped with a warning.
 */
public final class ZoneGrouper {
    private static final Logger log = LoggerFactory.getLogger(ZoneGrouper.class);

    /**
     * @param resolver a resolver without zones or aliases; members are plain numeric, semantic
     *                 or bare-name references
     */
    public ZoneIndex group(Collection<ZoneDefinition> zones, AddressResolver resolver, Consumer<ValidationWarning> warnings) {
        Map<String, Set<String>> members = new LinkedHashMap<>();
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (ZoneDefinition zone : zones) {
            Set<String> ids = new LinkedHashSet<>();
            for (String ref : zone.members()) {
                try {
                    ids.add(resolver.resolve(ref).nodeId());
                } catch (AddressResolutionException e) {
                    warnings.accept(ValidationWarning.user(zone.name(),
                            "zone member '" + ref + "' dropped: " + e.getMessage()));
                }
            }
            members.put(zone.name(), ids);
            descriptions.put(zone.name(), zone.description());
            log.debug("Zone {} has {} members", zone.name(), ids.size());
        }
        return new ZoneIndex(members, descriptions);
    }
}
