package io.treeshell.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.config.ConfigKind;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.load.FamilyLoad;
import io.treeshell.load.FamilyLoader;
import io.treeshell.load.NodeValidator;
import io.treeshell.model.Family;
import io.treeshell.model.MenuNode;
import io.treeshell.model.Node;
import io.treeshell.model.Shortcut;
import io.treeshell.model.ValidationWarning;
import io.treeshell.nav.NavConfig;
import io.treeshell.store.NodeStore;
import io.treeshell.util.Jsons;
import io.treeshell.zone.ZoneDefinition;
import io.treeshell.zone.ZoneDefinitionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Builds one {@link MergedConfig} from the system and user layers on disk. Every call re-reads
 * all files and keeps no state between calls, so merging unchanged files twice gives equal results.
 */
public final class ConfigMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(ConfigMergeEngine.class);

    private final FamilyLoader familyLoader;

    public ConfigMergeEngine() {
        this(new FamilyLoader());
    }

    public ConfigMergeEngine(FamilyLoader familyLoader) {
        this.familyLoader = familyLoader;
    }

    public MergedConfig merge(TreeShellConfig config) {
        List<ValidationWarning> warnings = new ArrayList<>();
        Consumer<ValidationWarning> sink = warning -> {
            log.warn("Validation warning: {}", warning);
            warnings.add(warning);
        };

        Map<String, Family> loadedFamilies = new TreeMap<>();
        Map<String, ObjectNode> systemNodes = new LinkedHashMap<>();
        for (String name : familyLoader.discover(config)) {
            FamilyLoad load = familyLoader.load(config, name);
            // the loader already logged these
            warnings.addAll(load.warnings());
            if (!load.loaded()) {
                continue;
            }
            loadedFamilies.put(name, load.family());
            systemNodes.putAll(load.nodes());
        }

        Customization nodeCustomization = Customization.read(config.customizationFile(ConfigKind.NODES), sink);
        Map<String, Node> merged = new LayerMerger<>(new NodeValidator(loadedFamilies.keySet()), sink, true)
                .merge(systemNodes, nodeCustomization);
        graftFamilies(loadedFamilies, merged, sink);
        dropDanglingOptions(merged, sink);

        Map<String, Family> families = new LinkedHashMap<>();
        for (Family family : loadedFamilies.values()) {
            List<String> ids = new ArrayList<>();
            for (String id : merged.keySet()) {
                if (Node.familyOf(id).equals(family.name())) {
                    ids.add(id);
                }
            }
            families.put(family.name(), new Family(family.name(), family.parent(), family.domain(),
                    family.description(), family.source(), ids));
        }

        Map<String, Shortcut> shortcuts = new LayerMerger<>(new ShortcutValidator(), sink, false).merge(
                readSystemEntries(config.systemFile(ConfigKind.SHORTCUTS), "shortcuts", sink),
                Customization.read(config.customizationFile(ConfigKind.SHORTCUTS), sink));

        Map<String, ZoneDefinition> zones = new LayerMerger<>(new ZoneDefinitionValidator(families.keySet()), sink, false).merge(
                readSystemEntries(config.systemFile(ConfigKind.ZONES), "zones", sink),
                Customization.read(config.customizationFile(ConfigKind.ZONES), sink));

        NavConfig nav = readNavConfig(config, sink);
        NodeStore store = new NodeStore(merged);
        log.info("Merged configuration: families={} nodes={} shortcuts={} zones={} warnings={}",
                families.size(), store.size(), shortcuts.size(), zones.size(), warnings.size());
        return new MergedConfig(store, families, shortcuts, zones, nav, warnings);
    }

    /**
     * Adds {@code <family> -> <root>} to the parent menu of every family that names one.
     */
    static void graftFamilies(Map<String, Family> families, Map<String, Node> nodes, Consumer<ValidationWarning> sink) {
        for (Family family : families.values()) {
            String parentId = family.parent();
            if (parentId == null || !nodes.containsKey(family.rootId())) {
                continue;
            }
            Node parent = nodes.get(parentId);
            if (parent == null) {
                sink.accept(ValidationWarning.system(family.name(), "parent '" + parentId + "' does not exist"));
                continue;
            }
            if (!(parent instanceof MenuNode)) {
                sink.accept(ValidationWarning.system(family.name(), "parent '" + parentId + "' is not a menu"));
                continue;
            }
            if (Node.familyOf(parentId).equals(family.name())) {
                sink.accept(ValidationWarning.system(family.name(), "parent must belong to another family"));
                continue;
            }
            MenuNode menu = (MenuNode) parent;
            if (menu.options().containsValue(family.rootId()) || menu.options().containsKey(family.name())) {
                continue;
            }
            nodes.put(parentId, menu.withOption(family.name(), family.rootId()));
        }
    }

    static void dropDanglingOptions(Map<String, Node> nodes, Consumer<ValidationWarning> sink) {
        for (Map.Entry<String, Node> entry : nodes.entrySet()) {
            if (!(entry.getValue() instanceof MenuNode)) {
                continue;
            }
            MenuNode menu = (MenuNode) entry.getValue();
            Set<String> dangling = new HashSet<>();
            menu.options().forEach((selector, target) -> {
                if (!nodes.containsKey(target)) {
                    dangling.add(selector);
                    sink.accept(ValidationWarning.system(menu.id(),
                            "option '" + selector + "' points at missing node '" + target + "' and was dropped"));
                }
            });
            if (!dangling.isEmpty()) {
                entry.setValue(menu.withoutSelectors(dangling));
            }
        }
    }

    static Map<String, ObjectNode> readSystemEntries(Path file, String wrapperField, Consumer<ValidationWarning> sink) {
        Map<String, ObjectNode> out = new LinkedHashMap<>();
        JsonNode root;
        try {
            root = Jsons.readTreeIfExists(file);
        } catch (IOException e) {
            sink.accept(ValidationWarning.system(file.getFileName().toString(), "file is not valid JSON: " + e.getMessage()));
            return out;
        }
        if (root == null) {
            return out;
        }
        JsonNode entries = root.has(wrapperField) ? root.get(wrapperField) : root;
        if (!entries.isObject()) {
            sink.accept(ValidationWarning.system(file.getFileName().toString(), "expected an object of entries"));
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> it = entries.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue().isObject()) {
                out.put(entry.getKey(), (ObjectNode) entry.getValue());
            } else {
                sink.accept(ValidationWarning.system(entry.getKey(), "entry must be an object"));
            }
        }
        return out;
    }

    static NavConfig readNavConfig(TreeShellConfig config, Consumer<ValidationWarning> sink) {
        try {
            NavConfig user = NavConfig.read(config.userNavConfig());
            if (user != null) {
                return user;
            }
        } catch (IOException e) {
            sink.accept(ValidationWarning.user(TreeShellConfig.NAV_CONFIG_FILE, "unreadable, using system nav config: " + e.getMessage()));
        }
        try {
            NavConfig system = NavConfig.read(config.systemNavConfig());
            return system == null ? NavConfig.empty() : system;
        } catch (IOException e) {
            sink.accept(ValidationWarning.system(TreeShellConfig.NAV_CONFIG_FILE, "unreadable, no nav coordinates assigned: " + e.getMessage()));
            return NavConfig.empty();
        }
    }
}
