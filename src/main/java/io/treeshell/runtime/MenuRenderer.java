package io.treeshell.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.treeshell.model.ArgSpec;
import io.treeshell.model.CallableNode;
import io.treeshell.model.ComboAddress;
import io.treeshell.model.NavEntry;
import io.treeshell.model.Node;
import io.treeshell.resolve.View;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only views: the {@code .0} menu of a node, the {@code .1.0} argument review of a
 * callable, and the assembled nav tree.
 */
public final class MenuRenderer {
    static final int MAX_TREE_DEPTH = 12;

    private MenuRenderer() {
    }

    public static MenuView menu(ShellSnapshot snapshot, Node node) {
        List<OptionLine> options = new ArrayList<>();
        for (Map.Entry<String, String> option : node.options().entrySet()) {
            Optional<Node> child = snapshot.nodes().find(option.getValue());
            options.add(new OptionLine(
                    option.getKey(),
                    option.getValue(),
                    child.map(Node::label).orElse(option.getValue()),
                    child.map(c -> c.kind().wireName()).orElse(null)
            ));
        }
        Map<String, String> universal = new LinkedHashMap<>();
        universal.put(Node.SELECTOR_MENU, node.id() + "." + View.MENU.suffix());
        if (node.isCallable()) {
            universal.put(Node.SELECTOR_ACTION, node.id() + "." + View.ACTION.suffix());
            universal.put(View.EXECUTE.suffix(), node.id() + "." + View.EXECUTE.suffix());
        }
        return new MenuView(
                node.id(),
                node.kind().wireName(),
                node.label(),
                node.description(),
                snapshot.nav().comboFor(node.id(), snapshot.nodes()).map(ComboAddress::toString).orElse(null),
                List.copyOf(snapshot.zones().zonesOf(node.id())),
                options,
                universal,
                node.isCallable() ? schemaOf((CallableNode) node) : null
        );
    }

    public static ReviewView review(CallableNode node) {
        return new ReviewView(
                node.id(),
                node.label(),
                node.binding().functionName(),
                node.binding().async(),
                schemaOf(node),
                node.id() + "." + View.EXECUTE.suffix(),
                node.id() + "." + View.MENU.suffix()
        );
    }

    /**
     * Tree of every family with a coordinate, in nav order, plus families reachable only by path.
     */
    public static NavView navAll(ShellSnapshot snapshot) {
        List<TreeLine> roots = new ArrayList<>();
        for (NavEntry entry : snapshot.nav().entries()) {
            roots.add(tree(snapshot, entry.family(), entry.coordinate(), 0, new HashSet<>()));
        }
        List<String> unassigned = new ArrayList<>();
        for (String family : snapshot.config().families().keySet()) {
            if (snapshot.nav().coordinateOf(family).isEmpty()) {
                unassigned.add(family);
            }
        }
        Map<String, List<String>> zones = new LinkedHashMap<>();
        for (String zone : snapshot.zones().zoneNames()) {
            zones.put(zone, List.copyOf(snapshot.zones().members(zone)));
        }
        return new NavView("all", null, roots, unassigned, zones);
    }

    public static NavView navFrom(ShellSnapshot snapshot, String scopeKind, String scope, Node start) {
        String address = snapshot.nav().comboFor(start.id(), snapshot.nodes()).map(ComboAddress::coordinate).orElse(null);
        TreeLine root = tree(snapshot, start.id(), address, 0, new HashSet<>());
        return new NavView(scopeKind, scope, List.of(root), List.of(), Map.of());
    }

    public static NavView navZone(ShellSnapshot snapshot, String zone) {
        List<TreeLine> members = new ArrayList<>();
        for (String id : snapshot.zones().members(zone)) {
            Node node = snapshot.nodes().find(id).orElse(null);
            if (node == null) {
                continue;
            }
            Optional<ComboAddress> combo = snapshot.nav().comboFor(id, snapshot.nodes());
            members.add(new TreeLine(
                    id,
                    combo.map(ComboAddress::coordinate).orElse(null),
                    combo.map(ComboAddress::toString).orElse(null),
                    node.label(),
                    node.kind().wireName(),
                    List.of()
            ));
        }
        return new NavView("zone", zone, members, List.of(), Map.of(zone, List.copyOf(snapshot.zones().members(zone))));
    }

    private static TreeLine tree(ShellSnapshot snapshot, String id, String address, int depth, Set<String> trail) {
        Node node = snapshot.nodes().find(id).orElse(null);
        String combo = address == null ? null : address + ComboAddress.SEPARATOR + id;
        if (node == null) {
            return new TreeLine(id, address, combo, id, null, List.of());
        }
        List<TreeLine> children = new ArrayList<>();
        if (depth < MAX_TREE_DEPTH && trail.add(id)) {
            for (Map.Entry<String, String> option : node.options().entrySet()) {
                String childId = option.getValue();
                String childAddress = address == null ? null : address + "." + option.getKey();
                boolean foreignRoot = !Node.familyOf(childId).equals(Node.familyOf(id))
                        && snapshot.nav().coordinateOf(childId).isPresent();
                if (foreignRoot) {
                    Node child = snapshot.nodes().find(childId).orElse(null);
                    children.add(new TreeLine(childId, childAddress,
                            childAddress == null ? null : childAddress + ComboAddress.SEPARATOR + childId,
                            child == null ? childId : child.label(),
                            child == null ? null : child.kind().wireName(),
                            List.of()));
                    continue;
                }
                children.add(tree(snapshot, childId, childAddress, depth + 1, trail));
            }
            trail.remove(id);
        }
        return new TreeLine(id, address, combo, node.label(), node.kind().wireName(), children);
    }

    private static Map<String, String> schemaOf(CallableNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, ArgSpec> entry : node.binding().argsSchema().entrySet()) {
            ArgSpec spec = entry.getValue();
            out.put(entry.getKey(), spec.type().wireName() + (spec.required() ? "" : "?") + (spec.sensitive() ? " (sensitive)" : ""));
        }
        return out;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MenuView(
            String id,
            String type,
            String label,
            String description,
            String combo,
            List<String> zones,
            List<OptionLine> options,
            Map<String, String> universal,
            Map<String, String> argsSchema
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OptionLine(String selector, String target, String label, String type) {
    }

    public record ReviewView(
            String id,
            String label,
            String functionName,
            boolean async,
            Map<String, String> argsSchema,
            String executeAddress,
            String menuAddress
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TreeLine(
            String id,
            String address,
            String combo,
            String label,
            String type,
            List<TreeLine> children
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NavView(
            String scopeKind,
            String scope,
            List<TreeLine> roots,
            List<String> unassignedFamilies,
            Map<String, List<String>> zones
    ) {
    }
}
