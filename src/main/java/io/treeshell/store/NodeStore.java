package io.treeshell.store;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.model.CallableNode;
import io.treeshell.model.MenuNode;
import io.treeshell.model.Node;
import io.treeshell.util.Jsons;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable keyed container of the nodes produced by one merge pass.
 * Safe for any number of concurrent readers.
 */
public final class NodeStore {
    private final Map<String, Node> nodes;
    private final Map<String, List<String>> byLeafName;

    public NodeStore(Map<String, ? extends Node> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        Map<String, List<String>> leaves = new LinkedHashMap<>();
        for (String id : this.nodes.keySet()) {
            leaves.computeIfAbsent(Node.leafOf(id), k -> new ArrayList<>()).add(id);
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        leaves.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.byLeafName = Collections.unmodifiableMap(frozen);
    }

    public static NodeStore empty() {
        return new NodeStore(Map.of());
    }

    public Optional<Node> find(String id) {
        return Optional.ofNullable(id == null ? null : nodes.get(id));
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Ids whose final path segment equals {@code leafName}, in store order.
     */
    public List<String> idsWithLeafName(String leafName) {
        return byLeafName.getOrDefault(leafName, List.of());
    }

    public Collection<Node> nodes() {
        return nodes.values();
    }

    public List<String> ids() {
        return List.copyOf(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Stable textual form of the whole store; two stores with equal content render equal text.
     */
    public String toCanonicalJson() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        for (Node node : nodes.values()) {
            ObjectNode entry = root.putObject(node.id());
            entry.put("type", node.kind().wireName());
            entry.put("label", node.label());
            entry.put("description", node.description());
            if (node instanceof MenuNode) {
                ObjectNode options = entry.putObject("options");
                node.options().forEach(options::put);
            } else {
                CallableNode callable = (CallableNode) node;
                entry.put("function_name", callable.binding().functionName());
                entry.put("is_async", callable.binding().async());
                ObjectNode schema = entry.putObject("args_schema");
                callable.binding().argsSchema().forEach((name, spec) -> {
                    ObjectNode arg = schema.putObject(name);
                    arg.put("type", spec.type().wireName());
                    arg.put("required", spec.required());
                    if (spec.sensitive()) {
                        arg.put("sensitive", true);
                    }
                });
            }
        }
        ArrayNode order = root.putArray("_order");
        nodes.keySet().forEach(order::add);
        return Jsons.toCompactJson(root);
    }
}
