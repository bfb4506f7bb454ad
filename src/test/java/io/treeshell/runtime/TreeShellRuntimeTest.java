package io.treeshell.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.TreeShellFixtures;
import io.treeshell.config.ConfigKind;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.exec.ExecutionException;
import io.treeshell.model.Shortcut;
import io.treeshell.model.WorkflowStatus;
import io.treeshell.nav.NavConflictException;
import io.treeshell.resolve.AddressResolutionException;
import io.treeshell.resolve.View;
import io.treeshell.util.Jsons;
import io.treeshell.workflow.ApprovalOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class TreeShellRuntimeTest {
    private Path root;
    private TreeShellConfig config;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("treeshell-test-runtime-");
        config = TreeShellConfig.fromRoot(root.toString());
        TreeShellRuntime.InitOutcome init = TreeShellRuntime.init(config, false);
        Assertions.assertEquals(StarterLibrary.FILES.size(), init.installed().size());
    }

    @AfterEach
    void tearDown() throws Exception {
        TreeShellFixtures.deleteRecursively(root);
    }

    private static ObjectNode args(String json) throws Exception {
        return (ObjectNode) Jsons.mapper().readTree(json);
    }

    @Test
    void initKeepsExistingFilesUnlessOverwriting() {
        Assertions.assertTrue(TreeShellRuntime.init(config, false).installed().isEmpty());
        Assertions.assertEquals(StarterLibrary.FILES.size(), TreeShellRuntime.init(config, true).installed().size());
    }

    @Test
    void jumpRendersMenuReviewOrExecutesByView() throws Exception {
        try (TreeShellRuntime runtime = TreeShellRuntime.open(config)) {
            TreeShellRuntime.JumpOutcome menu = runtime.jump("0.0.3", null, "alice");
            Assertions.assertEquals(View.MENU.name(), menu.view());
            Assertions.assertEquals("0.0.3::system.math", menu.menu().combo());
            Assertions.assertEquals(2, menu.menu().options().size());

            TreeShellRuntime.JumpOutcome review = runtime.jump("system.math.add.1", null, "alice");
            Assertions.assertEquals("add", review.review().functionName());
            Assertions.assertEquals("system.math.add.1.1", review.review().executeAddress());
            Assertions.assertNull(review.execution());

            TreeShellRuntime.JumpOutcome run = runtime.jump("0.0.3.2.1.1", args("{\"a\": 2, \"b\": 3}"), "alice");
            Assertions.assertEquals(5L, run.execution().result().asLong());
            Assertions.assertEquals(WorkflowStatus.QUARANTINE, run.execution().record().status());
            Assertions.assertEquals(WorkflowStatus.QUARANTINE, runtime.record("add").status());
            Assertions.assertEquals(1, runtime.pending().size());

            ExecutionException menuAction = Assertions.assertThrows(ExecutionException.class,
                    () -> runtime.jump("system.math.1", null, "alice"));
            Assertions.assertEquals(ExecutionException.Kind.CALLABLE_REQUIRED, menuAction.getKind());
        }
    }

    @Test
    void chainPassesResultsBetweenSteps() {
        try (TreeShellRuntime runtime = TreeShellRuntime.open(config)) {
            TreeShellRuntime.JumpOutcome viaShortcut = runtime.jump("sum_then_double", null, "alice");
            Assertions.assertTrue(viaShortcut.chain().succeeded());
            Assertions.assertEquals(6L, viaShortcut.chain().lastResult().asLong());

            TreeShellRuntime.ChainOutcome chain = runtime.chain(
                    "system.math.add {\"a\": 2, \"b\": 2} -> e {\"message\": \"sum={$step1_result}\"}", "alice");
            Assertions.assertTrue(chain.succeeded());
            Assertions.assertEquals(2, chain.steps().size());
            Assertions.assertEquals("sum=4", chain.lastResult().path("received").path("message").asText());
        }
    }

    @Test
    void chainStopsAtFirstFailingStep() {
        try (TreeShellRuntime runtime = TreeShellRuntime.open(config)) {
            TreeShellRuntime.ChainOutcome chain = runtime.chain(
                    "system.math.add {\"a\": 1, \"b\": 1} -> system.diagnostics.fail -> system.echo", "alice");

            Assertions.assertFalse(chain.succeeded());
            Assertions.assertEquals(2, chain.failedStep());
            Assertions.assertEquals(ExecutionException.Kind.CALLABLE_FAILURE.name(), chain.errorKind());
            Assertions.assertEquals(1, chain.steps().size());
            Assertions.assertEquals(2L, chain.lastResult().asLong());
            Assertions.assertEquals(WorkflowStatus.UNRAN, runtime.record("system.echo").status());
        }
    }

    @Test
    void registeredShortcutIsPersistedAndActive() throws Exception {
        try (TreeShellRuntime runtime = TreeShellRuntime.open(config)) {
            TreeShellRuntime.ShortcutOutcome jump = runtime.registerShortcut("calc", "0.0.3", "math menu", "alice");
            Assertions.assertTrue(jump.reloaded());
            Assertions.assertEquals(2L, jump.generation());
            Assertions.assertFalse(jump.shadowed());
            Assertions.assertEquals("system.math", runtime.resolve("calc").nodeId());

            TreeShellRuntime.ShortcutOutcome chain = runtime.registerShortcut("twice",
                    "system.math.multiply {\"a\": 2, \"b\": 2} -> system.echo", null, "alice");
            Assertions.assertEquals(Shortcut.Type.CHAIN.name(), chain.type());

            TreeShellRuntime.ShortcutOutcome shadowed = runtime.registerShortcut("equipment", "system.echo", null, "alice");
            Assertions.assertTrue(shadowed.shadowed());
        }
        String written = Files.readString(config.customizationFile(ConfigKind.SHORTCUTS), StandardCharsets.UTF_8);
        Assertions.assertTrue(written.contains("calc"));
        try (TreeShellRuntime reopened = TreeShellRuntime.open(config)) {
            Assertions.assertEquals("system.math", reopened.resolve("calc").nodeId());
            Assertions.assertTrue(reopened.jump("twice", null, "alice").chain().succeeded());
        }
    }

    @Test
    void shortcutToUnknownTargetIsRejectedWithoutWriting() {
        try (TreeShellRuntime runtime = TreeShellRuntime.open(config)) {
            Assertions.assertThrows(AddressResolutionException.class,
                    () -> runtime.registerShortcut("nowhere", "system.nope", null, "alice"));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.registerShortcut("two words", "system.echo", null, "alice"));
        }
        Assertions.assertFalse(Files.exists(config.customizationFile(ConfigKind.SHORTCUTS)));
    }

    @Test
    void reloadAppliesEditsAndRejectsNavConflicts() throws Exception {
        try (TreeShellRuntime runtime = TreeShellRuntime.open(config)) {
            TreeShellFixtures.write(config.customizationFile(ConfigKind.NODES), """
                    {"add_nodes": {"system.extra": {"type": "Callable", "function_name": "echo", "args_schema": {}}}}
                    """);
            TreeShellRuntime.ReloadOutcome applied = runtime.reload();
            Assertions.assertTrue(applied.applied());
            Assertions.assertEquals(2L, applied.generation());
            Assertions.assertEquals("system.extra", runtime.resolve("extra").nodeId());

            TreeShellFixtures.write(config.userNavConfig(), """
                    {"family_coordinates": {"system": "0.5", "conversations": "0.5"}}
                    """);
            TreeShellRuntime.ReloadOutcome rejected = runtime.reload();
            Assertions.assertFalse(rejected.applied());
            Assertions.assertEquals(2L, rejected.generation());
            Assertions.assertFalse(rejected.conflicts().isEmpty());
            Assertions.assertEquals("system.extra", runtime.resolve("0.0.extra").nodeId());
        }
        Assertions.assertThrows(NavConflictException.class, () -> TreeShellRuntime.open(config));
        Assertions.assertFalse(TreeShellRuntime.validate(config).ok());
    }

    @Test
    void approvalIsExplicitAndAudited() throws Exception {
        try (TreeShellRuntime runtime = TreeShellRuntime.open(config)) {
            runtime.jump("system.echo.1.1", args("{\"message\": \"hi\"}"), "alice");
            runtime.jump("system.echo.1.1", null, "alice");
            Assertions.assertEquals(WorkflowStatus.QUARANTINE, runtime.record("0.0.2").status());

            ApprovalOutcome approved = runtime.approve("0.0.2", "bob");
            Assertions.assertEquals(ApprovalOutcome.Result.APPROVED, approved.result());
            Assertions.assertEquals(2L, approved.record().executionCount());
            Assertions.assertTrue(runtime.pending().isEmpty());

            ApprovalOutcome revoked = runtime.revoke("system.echo", "bob");
            Assertions.assertEquals(WorkflowStatus.QUARANTINE, revoked.record().status());

            Assertions.assertTrue(runtime.verifyAudit().ok());
            String audit = Files.readString(config.auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(audit.contains("workflow.approved"));
            Assertions.assertTrue(audit.contains("node.execute"));
        }
    }

    @Test
    void argumentsDeclaredSensitiveAreMaskedInAudit() throws Exception {
        TreeShellFixtures.write(config.customizationFile(ConfigKind.NODES), """
                {"add_nodes": {"system.login": {"type": "Callable", "prompt": "Login", "function_name": "echo",
                  "args_schema": {"user": "string", "pin": {"type": "string", "sensitive": true}}}}}
                """);
        try (TreeShellRuntime runtime = TreeShellRuntime.open(config)) {
            runtime.jump("system.login.1.1", args("{\"user\": \"alice\", \"pin\": \"4711-secretish\"}"), "alice");

            String audit = Files.readString(config.auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(audit.contains("system.login"));
            Assertions.assertFalse(audit.contains("4711-secretish"));
            Assertions.assertTrue(audit.contains("alice"));
        }
    }
}
