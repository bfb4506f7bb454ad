package io.treeshell.nav;

import io.treeshell.model.ComboAddress;
import io.treeshell.model.NavEntry;
import io.treeshell.model.Node;
import io.treeshell.store.NodeStore;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bidirectional coordinate/family mapping produced by {@link NavAssigner}.
 */
public final class NavMap {
    private final List<NavEntry> entries;
    private final Map<String, String> familyByCoordinate;
    private final Map<String, String> coordinateByFamily;

    NavMap(List<NavEntry> entries) {
        this.entries = List.copyOf(entries);
        Map<String, String> byCoord = new LinkedHashMap<>();
        Map<String, String> byFamily = new LinkedHashMap<>();
        for (NavEntry entry : entries) {
            byCoord.put(entry.coordinate(), entry.family());
            byFamily.put(entry.family(), entry.coordinate());
        }
        this.familyByCoordinate = Collections.unmodifiableMap(byCoord);
        this.coordinateByFamily = Collections.unmodifiableMap(byFamily);
    }

    public static NavMap empty() {
        return new NavMap(List.of());
    }

    public List<NavEntry> entries() {
        return entries;
    }

    public Optional<String> familyAt(String coordinate) {
        return Optional.ofNullable(familyByCoordinate.get(coordinate));
    }

    public Optional<String> coordinateOf(String family) {
        return Optional.ofNullable(coordinateByFamily.get(family));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Number of leading segments forming the longest assigned coordinate, or 0.
     */
    public int longestCoordinatePrefix(String[] segments) {
        StringBuilder sb = new StringBuilder();
        int best = 0;
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(segments[i]);
            if (familyByCoordinate.containsKey(sb.toString())) {
                best = i + 1;
            }
        }
        return best;
    }

    /**
     * Numeric address of {@code nodeId}, reached from its own family's coordinate by option
     * selectors. Empty when the family has no coordinate or the node is not reachable that way.
     */
    public Optional<ComboAddress> comboFor(String nodeId, NodeStore store) {
        String family = Node.familyOf(nodeId);
        String coordinate = coordinateByFamily.get(family);
        if (coordinate == null || !store.contains(family)) {
            return Optional.empty();
        }
        Deque<String[]> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        queue.add(new String[]{family, coordinate});
        seen.add(family);
        while (!queue.isEmpty()) {
            String[] current = queue.poll();
            if (current[0].equals(nodeId)) {
                return Optional.of(new ComboAddress(current[1], nodeId));
            }
            Optional<Node> node = store.find(current[0]);
            if (node.isEmpty()) {
                continue;
            }
            for (Map.Entry<String, String> option : node.get().options().entrySet()) {
                if (seen.add(option.getValue())) {
                    queue.add(new String[]{option.getValue(), current[1] + "." + option.getKey()});
                }
            }
        }
        return Optional.empty();
    }
}
