package io.treeshell.merge;

import io.treeshell.TreeShellFixtures;
import io.treeshell.config.ConfigKind;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.model.CallableNode;
import io.treeshell.model.Node;
import io.treeshell.model.Shortcut;
import io.treeshell.model.ValidationWarning;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ConfigMergeEngineTest {

    @Test
    void overrideReplacesOnlyTheNamedFields() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-merge-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.customizationFile(ConfigKind.NODES), """
                    {"override_nodes": {"system.echo": {"prompt": "Say it"}}}
                    """);

            MergedConfig merged = new ConfigMergeEngine().merge(config);

            Node echo = merged.nodes().find("system.echo").orElseThrow();
            Assertions.assertEquals("Say it", echo.label());
            Assertions.assertEquals("echo", ((CallableNode) echo).binding().functionName());
            Assertions.assertEquals("Returns the arguments it was called with", echo.description());
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void exclusionWinsOverOverrideAndAddition() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-merge-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.customizationFile(ConfigKind.NODES), """
                    {
                      "override_nodes": {"system.math.add": {"prompt": "Plus"}},
                      "add_nodes": {
                        "system.extra": {"type": "Callable", "function_name": "echo", "args_schema": {}}
                      },
                      "exclude_nodes": ["system.math.add", "system.extra"]
                    }
                    """);

            MergedConfig merged = new ConfigMergeEngine().merge(config);

            Assertions.assertFalse(merged.nodes().contains("system.math.add"));
            Assertions.assertFalse(merged.nodes().contains("system.extra"));
            Assertions.assertFalse(merged.nodes().find("system.math").orElseThrow().options().containsKey("2"));
            Assertions.assertTrue(merged.warnings().stream()
                    .anyMatch(w -> "system.math".equals(w.nodeId()) && w.reason().contains("missing node")));
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void additionExtendsFamilyAndOverrideOfMissingNodeIsWarned() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-merge-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.customizationFile(ConfigKind.NODES), """
                    {
                      "override_nodes": {"system.ghost": {"prompt": "Boo"}},
                      "add_nodes": {
                        "system.extra": {"type": "Callable", "prompt": "Extra", "function_name": "echo", "args_schema": {}},
                        "nowhere.node": {"type": "Callable", "function_name": "echo", "args_schema": {}}
                      }
                    }
                    """);

            MergedConfig merged = new ConfigMergeEngine().merge(config);

            Assertions.assertTrue(merged.nodes().contains("system.extra"));
            Assertions.assertTrue(merged.families().get("system").nodeIds().contains("system.extra"));
            Assertions.assertFalse(merged.nodes().contains("system.ghost"));
            Assertions.assertFalse(merged.nodes().contains("nowhere.node"));
            Assertions.assertTrue(merged.warnings().stream()
                    .anyMatch(w -> w.layer() == ValidationWarning.Layer.USER && "system.ghost".equals(w.nodeId())));
            Assertions.assertTrue(merged.warnings().stream()
                    .anyMatch(w -> w.layer() == ValidationWarning.Layer.USER && "nowhere.node".equals(w.nodeId())));
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void nodeIdWithUniversalSelectorSegmentIsDropped() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-merge-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.customizationFile(ConfigKind.NODES), """
                    {
                      "add_nodes": {
                        "system.0": {"type": "Callable", "prompt": "Shadow", "function_name": "echo", "args_schema": {}},
                        "system.1.extra": {"type": "Callable", "prompt": "Deep", "function_name": "echo", "args_schema": {}}
                      }
                    }
                    """);

            MergedConfig merged = new ConfigMergeEngine().merge(config);

            Assertions.assertFalse(merged.nodes().contains("system.0"));
            Assertions.assertFalse(merged.nodes().contains("system.1.extra"));
            Assertions.assertTrue(merged.warnings().stream()
                    .anyMatch(w -> "system.0".equals(w.nodeId()) && w.reason().contains("universal selector")));
            Assertions.assertTrue(merged.warnings().stream()
                    .anyMatch(w -> "system.1.extra".equals(w.nodeId()) && w.reason().contains("universal selector")));
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void brokenCustomizationFileKeepsSystemLayer() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-merge-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.customizationFile(ConfigKind.NODES), "[1, 2");

            MergedConfig merged = new ConfigMergeEngine().merge(config);

            Assertions.assertTrue(merged.nodes().contains("system.echo"));
            Assertions.assertEquals(1, merged.warnings().size());
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void mergingUnchangedFilesTwiceIsDeterministic() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-merge-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.customizationFile(ConfigKind.NODES), """
                    {
                      "override_nodes": {"conversations": {"prompt": "Chats"}},
                      "add_nodes": {"conversations.pinned": {"type": "Callable", "function_name": "echo", "args_schema": {}}},
                      "exclude_nodes": ["conversations.archive"]
                    }
                    """);

            ConfigMergeEngine engine = new ConfigMergeEngine();
            MergedConfig first = engine.merge(config);
            MergedConfig second = engine.merge(config);

            Assertions.assertEquals(first.nodes().toCanonicalJson(), second.nodes().toCanonicalJson());
            Assertions.assertEquals(first.warnings(), second.warnings());
            Assertions.assertEquals(first.families(), second.families());
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void userShortcutsAndZonesMergeOverSystemFiles() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-merge-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.customizationFile(ConfigKind.SHORTCUTS), """
                    {
                      "add_nodes": {"calc": {"type": "jump", "coordinate": "system.math"}},
                      "exclude_nodes": ["gear"]
                    }
                    """);
            TreeShellFixtures.write(config.customizationFile(ConfigKind.ZONES), """
                    {
                      "override_nodes": {"tools": {"zone_tree": ["system.echo"]}},
                      "add_nodes": {"system": {"zone_tree": ["system.echo"]}}
                    }
                    """);

            MergedConfig merged = new ConfigMergeEngine().merge(config);

            Assertions.assertEquals(Shortcut.Type.JUMP, merged.shortcuts().get("calc").type());
            Assertions.assertFalse(merged.shortcuts().containsKey("gear"));
            Assertions.assertTrue(merged.shortcuts().containsKey("sum_then_double"));
            Assertions.assertEquals(List.of("system.echo"), merged.zones().get("tools").members());
            Assertions.assertFalse(merged.zones().containsKey("system"));
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }
}
