package io.treeshell.zone;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Zone name to member ids, plus the reverse index. Membership is many-to-many.
 */
public final class ZoneIndex {
    private final Map<String, Set<String>> membersByZone;
    private final Map<String, Set<String>> zonesByNode;
    private final Map<String, String> descriptions;

    ZoneIndex(Map<String, Set<String>> membersByZone, Map<String, String> descriptions) {
        Map<String, Set<String>> forward = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        membersByZone.forEach((zone, members) -> {
            forward.put(zone, Collections.unmodifiableSet(new LinkedHashSet<>(members)));
            for (String id : members) {
                reverse.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(zone);
            }
        });
        reverse.replaceAll((id, zones) -> Collections.unmodifiableSet(zones));
        this.membersByZone = Collections.unmodifiableMap(forward);
        this.zonesByNode = Collections.unmodifiableMap(reverse);
        this.descriptions = Collections.unmodifiableMap(new LinkedHashMap<>(descriptions));
    }

    public static ZoneIndex empty() {
        return new ZoneIndex(Map.of(), Map.of());
    }

    public boolean hasZone(String zone) {
        return membersByZone.containsKey(zone);
    }

    public Set<String> members(String zone) {
        return membersByZone.getOrDefault(zone, Set.of());
    }

    public Set<String> zonesOf(String nodeId) {
        return zonesByNode.getOrDefault(nodeId, Set.of());
    }

    public String description(String zone) {
        return descriptions.getOrDefault(zone, "");
    }

    public List<String> zoneNames() {
        return List.copyOf(membersByZone.keySet());
    }
}
