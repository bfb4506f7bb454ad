package io.treeshell.nav;

import io.treeshell.model.NavEntry;
import io.treeshell.model.ValidationWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Maps a priority-ordered subset of families onto numeric coordinates under a prefix.
 */
public final class NavAssigner {
    private static final Logger log = LoggerFactory.getLogger(NavAssigner.class);

    /**
     * @param loadedFamilies families present after the merge; others in the order are skipped
     * @throws NavConflictException when explicit coordinates collide or are malformed
     */
    public NavMap assign(NavConfig config, Set<String> loadedFamilies, Consumer<ValidationWarning> warnings) {
        Map<String, String> explicit = explicitCoordinates(config);

        LinkedHashSet<String> candidates = new LinkedHashSet<>(config.navTreeOrder());
        candidates.addAll(explicit.keySet());
        List<String> ordered = new ArrayList<>();
        for (String family : candidates) {
            if (loadedFamilies.contains(family)) {
                ordered.add(family);
            } else {
                warnings.accept(ValidationWarning.user(family, "nav order names a family that is not loaded"));
                log.warn("Nav order skips unloaded family {}", family);
            }
        }
        List<String> positional = new ArrayList<>(candidates);
        Map<String, Integer> priorities = new LinkedHashMap<>();
        for (String family : ordered) {
            priorities.put(family, config.familyPriorities().getOrDefault(family, positional.indexOf(family)));
        }
        // List.sort is stable, so equal priorities keep list order.
        ordered.sort(Comparator.comparingInt(priorities::get));

        Set<String> reserved = new HashSet<>();
        for (String family : ordered) {
            String coordinate = explicit.get(family);
            if (coordinate != null) {
                reserved.add(coordinate);
            }
        }
        rejectNestedCoordinates(ordered, explicit);

        List<NavEntry> entries = new ArrayList<>();
        int slot = config.firstSlot();
        for (String family : ordered) {
            String coordinate = explicit.get(family);
            boolean isExplicit = coordinate != null;
            if (!isExplicit) {
                while (reserved.contains(config.prefix() + "." + slot)
                        || isAncestorOfAny(config.prefix() + "." + slot, reserved)) {
                    slot++;
                }
                coordinate = config.prefix() + "." + slot;
                reserved.add(coordinate);
                slot++;
            }
            entries.add(new NavEntry(coordinate, family, priorities.get(family), isExplicit));
        }
        log.debug("Assigned {} nav coordinates under prefix {}", entries.size(), config.prefix());
        return new NavMap(entries);
    }

    /**
     * A coordinate nested under another active family's coordinate would address that family's
     * subtree and this one at once.
     */
    private static void rejectNestedCoordinates(List<String> active, Map<String, String> explicit) {
        List<String> conflicts = new ArrayList<>();
        for (String outer : active) {
            String outerCoordinate = explicit.get(outer);
            if (outerCoordinate == null) {
                continue;
            }
            for (String inner : active) {
                String innerCoordinate = explicit.get(inner);
                if (innerCoordinate != null && innerCoordinate.startsWith(outerCoordinate + ".")) {
                    conflicts.add("coordinate " + innerCoordinate + " for family '" + inner
                            + "' is nested under " + outerCoordinate + " of family '" + outer + "'");
                }
            }
        }
        if (!conflicts.isEmpty()) {
            throw new NavConflictException(conflicts);
        }
    }

    private static boolean isAncestorOfAny(String coordinate, Set<String> reserved) {
        for (String taken : reserved) {
            if (taken.startsWith(coordinate + ".")) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, String> explicitCoordinates(NavConfig config) {
        Pattern format = Pattern.compile(Pattern.quote(config.prefix()) + "(\\.\\d+)+");
        Map<String, String> byFamily = new LinkedHashMap<>();
        Map<String, String> byCoordinate = new LinkedHashMap<>();
        List<String> conflicts = new ArrayList<>();

        List<String[]> requests = new ArrayList<>();
        config.familyCoordinates().forEach((family, coord) -> requests.add(new String[]{family, coord}));
        config.coordinateMapping().forEach((coord, family) -> requests.add(new String[]{family, coord}));

        for (String[] request : requests) {
            String family = request[0] == null ? "" : request[0].trim();
            String coordinate = request[1] == null ? "" : request[1].trim();
            if (!format.matcher(coordinate).matches()) {
                conflicts.add("coordinate '" + coordinate + "' for family '" + family
                        + "' is not of the form " + config.prefix() + ".<n>");
                continue;
            }
            String previousCoordinate = byFamily.get(family);
            if (previousCoordinate != null && !previousCoordinate.equals(coordinate)) {
                conflicts.add("family '" + family + "' requests both " + previousCoordinate + " and " + coordinate);
                continue;
            }
            String holder = byCoordinate.get(coordinate);
            if (holder != null && !holder.equals(family)) {
                conflicts.add("coordinate " + coordinate + " requested by both '" + holder + "' and '" + family + "'");
                continue;
            }
            byFamily.put(family, coordinate);
            byCoordinate.put(coordinate, family);
        }
        if (!conflicts.isEmpty()) {
            throw new NavConflictException(conflicts);
        }
        return byFamily;
    }
}
