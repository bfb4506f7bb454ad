package io.treeshell.load;

import io.treeshell.TreeShellFixtures;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.model.ValidationWarning;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

final class FamilyLoaderTest {

    @Test
    void userFamilyReplacesSystemFamily() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-loader-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.userFamiliesDir().resolve("conversations_family.json"), """
                    {
                      "family_root": "conversations",
                      "nodes": {
                        "conversations": {"type": "Menu", "title": "My conversations", "options": {"2": "conversations.pinned"}},
                        "conversations.pinned": {"type": "Callable", "function_name": "echo", "args_schema": {}}
                      }
                    }
                    """);

            FamilyLoad load = new FamilyLoader().load(config, "conversations");

            Assertions.assertTrue(load.loaded());
            Assertions.assertEquals(ValidationWarning.Layer.USER, load.family().source());
            Assertions.assertEquals(Set.of("conversations", "conversations.pinned"), load.nodes().keySet());
            Assertions.assertTrue(load.warnings().isEmpty());
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void brokenUserFamilyFallsBackToSystemWithWarning() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-loader-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.userFamiliesDir().resolve("conversations_family.json"), "{ not json");

            FamilyLoad load = new FamilyLoader().load(config, "conversations");

            Assertions.assertTrue(load.loaded());
            Assertions.assertEquals(ValidationWarning.Layer.SYSTEM, load.family().source());
            Assertions.assertTrue(load.nodes().containsKey("conversations.search"));
            Assertions.assertEquals(1, load.warnings().size());
            Assertions.assertEquals(ValidationWarning.Layer.USER, load.warnings().get(0).layer());
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void invalidNodesAreSkippedAndReservedSelectorsDropped() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-loader-");
        try {
            Path file = root.resolve("demo_family.json");
            TreeShellFixtures.write(file, """
                    {
                      "family_root": "demo",
                      "nodes": {
                        "demo": {"type": "Menu", "prompt": "Demo", "options": {"0": "demo.run", "2": "demo.run"}},
                        "demo.run": {"type": "Callable", "function_name": "echo", "args_schema": {}},
                        "demo.broken": {"type": "Callable", "args_schema": {}},
                        "demo.weird": {"type": "Gadget", "prompt": "?"},
                        "other.node": {"type": "Callable", "function_name": "echo", "args_schema": {}}
                      }
                    }
                    """);

            FamilyLoad load = new FamilyLoader().load("demo", file, null);

            Assertions.assertTrue(load.loaded());
            Assertions.assertEquals(Set.of("demo", "demo.run"), load.nodes().keySet());
            Assertions.assertEquals(4, load.warnings().size());
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void mismatchedFamilyRootIsRejected() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-loader-");
        try {
            Path file = root.resolve("demo_family.json");
            TreeShellFixtures.write(file, """
                    {"family_root": "other", "nodes": {"demo": {"type": "Menu", "prompt": "Demo"}}}
                    """);

            FamilyLoad load = new FamilyLoader().load("demo", file, null);

            Assertions.assertFalse(load.loaded());
            Assertions.assertFalse(load.warnings().isEmpty());
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }

    @Test
    void discoverListsBothLayersSorted() throws Exception {
        Path root = Files.createTempDirectory("treeshell-test-loader-");
        try {
            TreeShellConfig config = TreeShellFixtures.starterRoot(root);
            TreeShellFixtures.write(config.userFamiliesDir().resolve("alpha_family.json"), "{}");

            Assertions.assertEquals(
                    List.of("agent_management", "alpha", "conversations", "system"),
                    List.copyOf(new FamilyLoader().discover(config)));
        } finally {
            TreeShellFixtures.deleteRecursively(root);
        }
    }
}
