package io.treeshell.resolve;

import io.treeshell.model.Node;
import io.treeshell.model.Shortcut;
import io.treeshell.nav.NavMap;
import io.treeshell.store.NodeStore;
import io.treeshell.zone.ZoneIndex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves caller tokens to one canonical node. Rules, first match wins: numeric coordinate,
 * semantic path, bare node name, zone-qualified path, alias.
 * <p>
 * A token is first tried whole. When that fails, trailing {@code 0}/{@code 1} selectors are
 * stripped and the remainder retried; the stripped tail picks the {@link View}.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public final class AddressResolver {
    private static final int MAX_VIEW_SEGMENTS = 2;

    private final NodeStore store;
    private final NavMap nav;
    private final ZoneIndex zones;
    private final Map<String, Shortcut> shortcuts;
    private final int maxAliasDepth;

    public AddressResolver(NodeStore store, NavMap nav, ZoneIndex zones, Map<String, Shortcut> shortcuts, int maxAliasDepth) {
        this.store = store;
        this.nav = nav;
        this.zones = zones;
        this.shortcuts = Map.copyOf(shortcuts);
        this.maxAliasDepth = maxAliasDepth;
    }

    /**
     * Resolver over nodes and coordinates only, used to resolve zone members.
     */
    public static AddressResolver withoutZonesOrAliases(NodeStore store, NavMap nav) {
        return new AddressResolver(store, nav, ZoneIndex.empty(), Map.of(), 0);
    }

    public NodeStore store() {
        return store;
    }

    public ResolvedAddress resolve(String token) {
        if (token == null || token.isBlank()) {
            throw AddressResolutionException.notFound(token == null ? "" : token);
        }
        return resolve(token.trim(), new HashSet<>());
    }

    private ResolvedAddress resolve(String token, Set<String> aliasTrail) {
        String[] segments = token.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw AddressResolutionException.notFound(token);
            }
        }
        for (int stripped = 0; stripped <= MAX_VIEW_SEGMENTS && stripped < segments.length; stripped++) {
            int baseLength = segments.length - stripped;
            if (stripped > 0 && !Node.isUniversalSelector(segments[baseLength])) {
                break;
            }
            View view = View.fromTail(String.join(".", Arrays.copyOfRange(segments, baseLength, segments.length)));
            if (view == null) {
                continue;
            }
            String[] baseSegments = Arrays.copyOf(segments, baseLength);
            String base = String.join(".", baseSegments);
            Match match = matchBase(base, baseSegments, aliasTrail);
            if (match == null) {
                continue;
            }
            View effective = stripped == 0 && match.aliasView() != null ? match.aliasView() : view;
            Node node = store.find(match.nodeId()).orElseThrow(() -> AddressResolutionException.notFound(token));
            return new ResolvedAddress(
                    node,
                    effective,
                    match.rule(),
                    base + "." + effective.suffix(),
                    node.id() + "." + effective.suffix()
            );
        }
        throw AddressResolutionException.notFound(token);
    }

    private Match matchBase(String base, String[] segments, Set<String> aliasTrail) {
        String numeric = walkNumeric(segments);
        if (numeric != null) {
            return new Match(numeric, MatchRule.NUMERIC, null);
        }
        if (store.contains(base)) {
            return new Match(base, MatchRule.SEMANTIC, null);
        }
        if (segments.length == 1) {
            String bare = uniqueLeaf(base, store.idsWithLeafName(base), null);
            if (bare != null) {
                return new Match(bare, MatchRule.BARE_NAME, null);
            }
        }
        if (segments.length > 1 && zones.hasZone(segments[0])) {
            String inZone = matchInZone(segments[0], Arrays.copyOfRange(segments, 1, segments.length));
            if (inZone != null) {
                return new Match(inZone, MatchRule.ZONE, null);
            }
        }
        Shortcut shortcut = shortcuts.get(base);
        if (shortcut != null && shortcut.type() == Shortcut.Type.JUMP) {
            if (aliasTrail.contains(base) || aliasTrail.size() >= maxAliasDepth) {
                return null;
            }
            aliasTrail.add(base);
            try {
                ResolvedAddress target = resolve(shortcut.target(), aliasTrail);
                return new Match(target.nodeId(), MatchRule.ALIAS, target.view());
            } catch (AddressResolutionException e) {
                if (e.getKind() == AddressResolutionException.Kind.AMBIGUOUS) {
                    throw e;
                }
                return null;
            } finally {
                aliasTrail.remove(base);
            }
        }
        return null;
    }

    /**
     * Longest assigned coordinate prefix, then option selectors, falling back to
     * {@code <current>.<segment>} when that id exists.
     */
    private String walkNumeric(String[] segments) {
        int prefixLength = nav.longestCoordinatePrefix(segments);
        if (prefixLength == 0) {
            return null;
        }
        String coordinate = String.join(".", Arrays.copyOf(segments, prefixLength));
        Optional<String> family = nav.familyAt(coordinate);
        if (family.isEmpty() || !store.contains(family.get())) {
            return null;
        }
        String current = family.get();
        for (int i = prefixLength; i < segments.length; i++) {
            Node node = store.find(current).orElse(null);
            if (node == null) {
                return null;
            }
            String next = node.options().get(segments[i]);
            if (next == null) {
                String child = current + "." + segments[i];
                if (!store.contains(child)) {
                    return null;
                }
                next = child;
            }
            current = next;
        }
        return store.contains(current) ? current : null;
    }

    private String matchInZone(String zone, String[] rest) {
        Set<String> members = zones.members(zone);
        String restToken = String.join(".", rest);
        String numeric = walkNumeric(rest);
        if (numeric != null && members.contains(numeric)) {
            return numeric;
        }
        if (members.contains(restToken)) {
            return restToken;
        }
        if (rest.length == 1) {
            return uniqueLeaf(zone + "." + restToken, store.idsWithLeafName(restToken), members);
        }
        return null;
    }

    private static String uniqueLeaf(String token, List<String> ids, Set<String> restrictTo) {
        List<String> candidates = new ArrayList<>();
        for (String id : ids) {
            if (restrictTo == null || restrictTo.contains(id)) {
                candidates.add(id);
            }
        }
        if (candidates.size() > 1) {
            throw new AddressResolutionException(AddressResolutionException.Kind.AMBIGUOUS, token,
                    "'" + token + "' matches " + candidates.size() + " nodes: " + String.join(", ", candidates),
                    candidates);
        }
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    private record Match(String nodeId, MatchRule rule, View aliasView) {
    }
}
