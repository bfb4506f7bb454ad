package io.treeshell.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.treeshell.TreeShellFixtures;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.runtime.MenuRenderer;
import io.treeshell.runtime.TreeShellRuntime;
import io.treeshell.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class ShellCommandProcessorTest {
    private Path root;
    private TreeShellRuntime runtime;
    private ShellCommandProcessor processor;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("treeshell-test-cli-");
        TreeShellConfig config = TreeShellConfig.fromRoot(root.toString());
        TreeShellRuntime.init(config, false);
        runtime = TreeShellRuntime.open(config);
        processor = new ShellCommandProcessor(runtime, "alice");
    }

    @AfterEach
    void tearDown() throws Exception {
        runtime.close();
        TreeShellFixtures.deleteRecursively(root);
    }

    @Test
    void numericSelectionWalksFromCurrentPosition() {
        ShellCommandProcessor.CommandResult jump = processor.execute("jump 0.1");
        Assertions.assertEquals(0, jump.exitCode());
        Assertions.assertEquals("agent_management", processor.position());

        processor.execute("3");
        Assertions.assertEquals("agent_management.equipment", processor.position());

        ShellCommandProcessor.CommandResult back = processor.execute("back");
        Assertions.assertEquals("agent_management", processor.position());
        Assertions.assertEquals("agent_management", ((MenuRenderer.MenuView) back.payload()).id());
    }

    @Test
    void executeSelectorRunsCallableWithRawJsonArguments() {
        processor.execute("jump system.math");

        ShellCommandProcessor.CommandResult result = processor.execute("2.1.1 {\"a\": 40,   \"b\": 2}");

        Assertions.assertEquals(0, result.exitCode());
        TreeShellRuntime.JumpOutcome outcome = (TreeShellRuntime.JumpOutcome) result.payload();
        Assertions.assertEquals(42L, outcome.execution().result().asLong());
    }

    @Test
    void errorsBecomePayloadsWithExitCodes() {
        ShellCommandProcessor.CommandResult missing = processor.execute("jump system.nope");
        Assertions.assertEquals(ShellCommandProcessor.EXIT_COMMAND_ERROR, missing.exitCode());
        ShellCommandProcessor.ErrorPayload error = (ShellCommandProcessor.ErrorPayload) missing.payload();
        Assertions.assertEquals("NOT_FOUND", error.error());
        Assertions.assertFalse(Jsons.toJson(error).contains("details"));

        ShellCommandProcessor.CommandResult badArgs = processor.jump("system.math.add.1.1", "{\"a\": 1}");
        Assertions.assertEquals("ARG_VALIDATION", ((ShellCommandProcessor.ErrorPayload) badArgs.payload()).error());

        ShellCommandProcessor.CommandResult notQuarantined = processor.approve("system.echo");
        Assertions.assertEquals("NOT_IN_QUARANTINE", ((ShellCommandProcessor.ErrorPayload) notQuarantined.payload()).error());

        ShellCommandProcessor.CommandResult usage = processor.execute("record");
        Assertions.assertEquals("USAGE", ((ShellCommandProcessor.ErrorPayload) usage.payload()).error());
    }

    @Test
    void failedChainExitsWithCommandError() {
        ShellCommandProcessor.CommandResult ok = processor.execute("chain system.math.add {\"a\": 1, \"b\": 2} -> system.echo");
        Assertions.assertEquals(0, ok.exitCode());

        ShellCommandProcessor.CommandResult failed = processor.execute("chain system.diagnostics.fail -> system.echo");
        Assertions.assertEquals(ShellCommandProcessor.EXIT_COMMAND_ERROR, failed.exitCode());
        Assertions.assertEquals(1, ((TreeShellRuntime.ChainOutcome) failed.payload()).failedStep());
    }

    @Test
    void approvalCommandsReportQueue() {
        processor.execute("jump system.echo.1.1");
        Assertions.assertEquals(1, ((List<?>) processor.execute("pending").payload()).size());

        Assertions.assertEquals(0, processor.execute("approve 0.0.2").exitCode());
        Assertions.assertTrue(((List<?>) processor.execute("pending").payload()).isEmpty());
        Assertions.assertEquals(1, ((List<?>) processor.execute("records").payload()).size());
    }

    @Test
    void sessionVariablesFeedJumpAndChainArguments() {
        Assertions.assertEquals(0, processor.execute("set base 40").exitCode());

        ShellCommandProcessor.CommandResult jump = processor.execute("jump system.math.add.1.1 {\"a\": \"$base\", \"b\": 2}");
        Assertions.assertEquals(42L, ((TreeShellRuntime.JumpOutcome) jump.payload()).execution().result().asLong());

        ShellCommandProcessor.CommandResult chain = processor.execute(
                "chain system.math.multiply {\"a\": \"$last_result\", \"b\": 2}");
        Assertions.assertEquals(84L, ((TreeShellRuntime.ChainOutcome) chain.payload()).lastResult().asLong());

        Map<?, ?> got = (Map<?, ?>) processor.execute("get base").payload();
        Assertions.assertEquals(40L, ((JsonNode) got.get("value")).asLong());
        Map<?, ?> vars = (Map<?, ?>) processor.execute("vars").payload();
        Assertions.assertEquals(84L, ((JsonNode) vars.get("last_result")).asLong());

        ShellCommandProcessor.CommandResult unset = processor.execute("get nothing");
        Assertions.assertEquals("INVALID_ARGUMENT", ((ShellCommandProcessor.ErrorPayload) unset.payload()).error());
        ShellCommandProcessor.CommandResult badName = processor.execute("set 9lives 1");
        Assertions.assertEquals(ShellCommandProcessor.EXIT_COMMAND_ERROR, badName.exitCode());
    }

    @Test
    void historyIsSavedAsPathwayAndFollowedLater() {
        processor.execute("set base 5");
        processor.execute("jump system.math.add.1.1 {\"a\": \"$base\", \"b\": 1}");
        processor.execute("jump system.echo.1.1 {\"message\": \"hello\"}");
        processor.execute("jump system.math.multiply.1.1 {\"a\": 3, \"b\": 7}");

        List<?> history = (List<?>) processor.execute("history").payload();
        Assertions.assertEquals(3, history.size());
        ShellSession.HistoryEntry first = (ShellSession.HistoryEntry) history.get(0);
        Assertions.assertEquals("system.math.add", first.nodeId());
        Assertions.assertEquals(5L, first.args().get("a").asLong());

        ShellCommandProcessor.CommandResult saved = processor.execute("save_pathway six_then_21 [0,2]");
        Assertions.assertEquals(0, saved.exitCode());
        Assertions.assertEquals("CHAIN", ((TreeShellRuntime.ShortcutOutcome) saved.payload()).type());

        ShellCommandProcessor other = new ShellCommandProcessor(runtime, "bob");
        ShellCommandProcessor.CommandResult followed = other.execute("follow six_then_21");
        Assertions.assertEquals(0, followed.exitCode());
        TreeShellRuntime.ChainOutcome chain = (TreeShellRuntime.ChainOutcome) followed.payload();
        Assertions.assertEquals(List.of("system.math.add", "system.math.multiply"),
                chain.steps().stream().map(TreeShellRuntime.ChainStepOutcome::nodeId).toList());
        Assertions.assertEquals(21L, chain.lastResult().asLong());
        Assertions.assertEquals(2, ((List<?>) other.execute("history").payload()).size());

        ShellCommandProcessor.CommandResult single = processor.execute("save_pathway just_echo 1");
        Assertions.assertEquals("CHAIN", ((TreeShellRuntime.ShortcutOutcome) single.payload()).type());
        Assertions.assertEquals(0, processor.execute("follow just_echo").exitCode());

        ShellCommandProcessor.CommandResult outOfRange = processor.execute("save_pathway broken 0-9");
        Assertions.assertEquals("INVALID_ARGUMENT", ((ShellCommandProcessor.ErrorPayload) outOfRange.payload()).error());
        ShellCommandProcessor.CommandResult notPathway = processor.execute("follow e");
        Assertions.assertEquals("INVALID_ARGUMENT", ((ShellCommandProcessor.ErrorPayload) notPathway.payload()).error());
    }

    @Test
    void exitStopsTheLoop() {
        Assertions.assertTrue(processor.execute("exit").exit());
        Assertions.assertFalse(processor.execute("help").exit());
    }
}
