package io.treeshell.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.TreeShellFixtures;
import io.treeshell.config.ShellSettings;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.model.ArgSpec;
import io.treeshell.model.Binding;
import io.treeshell.model.CallableNode;
import io.treeshell.model.MenuNode;
import io.treeshell.model.WorkflowStatus;
import io.treeshell.storage.Database;
import io.treeshell.storage.WorkflowStore;
import io.treeshell.util.Jsons;
import io.treeshell.workflow.ApprovalChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class ExecutionDispatcherTest {
    private static final CallableNode ADD = new CallableNode("system.math.add", "Add", "",
            new Binding("add", false, Map.of(
                    "a", new ArgSpec(ArgSpec.ArgType.NUMBER, true),
                    "b", new ArgSpec(ArgSpec.ArgType.NUMBER, true))));
    private static final CallableNode SLEEP = new CallableNode("system.sleep", "Sleep", "",
            new Binding("sleep", false, Map.of("ms", new ArgSpec(ArgSpec.ArgType.INTEGER, true))));
    private static final CallableNode ASYNC_SLEEP = new CallableNode("system.async_sleep", "Sleep", "",
            new Binding("sleep", true, Map.of("ms", new ArgSpec(ArgSpec.ArgType.INTEGER, true))));
    private static final CallableNode FAIL = new CallableNode("system.fail", "Fail", "",
            new Binding("fail", false, Map.of("message", new ArgSpec(ArgSpec.ArgType.STRING, false))));
    private static final CallableNode UNBOUND = new CallableNode("system.unbound", "Unbound", "",
            new Binding("no_such_function", false, Map.of()));

    private Path root;
    private WorkflowStore store;
    private ApprovalChannel channel;
    private ExecutionDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("treeshell-test-dispatch-");
        TreeShellConfig config = TreeShellConfig.fromRoot(root.toString());
        Database db = new Database(config);
        db.init();
        store = new WorkflowStore(db);
        channel = new ApprovalChannel();
        dispatcher = new ExecutionDispatcher(CallableRegistry.withDefaults(ShellSettings.defaults()), store, channel, 300L, 3);
    }

    @AfterEach
    void tearDown() throws Exception {
        dispatcher.close();
        TreeShellFixtures.deleteRecursively(root);
    }

    private static ObjectNode args(String json) throws Exception {
        return (ObjectNode) Jsons.mapper().readTree(json);
    }

    @Test
    void firstSuccessfulRunCreatesQuarantineRecordAndNotice() throws Exception {
        ExecutionOutcome outcome = dispatcher.dispatch(ADD, args("{\"a\": 2, \"b\": 3}"), "tester");

        Assertions.assertEquals(5L, outcome.result().asLong());
        Assertions.assertEquals(WorkflowStatus.QUARANTINE, outcome.record().status());
        Assertions.assertEquals(1L, outcome.record().executionCount());
        Assertions.assertEquals(1, channel.backlog());

        dispatcher.dispatch(ADD, args("{\"a\": 1, \"b\": 1}"), "tester");
        Assertions.assertEquals(2L, store.recordOrUnran(ADD.id()).executionCount());
        Assertions.assertEquals(1, channel.backlog());
    }

    @Test
    void argumentErrorsLeaveTheRecordUntouched() throws Exception {
        for (String json : new String[]{"{\"a\": 1}", "{\"a\": \"x\", \"b\": 1}", "{\"a\": 1, \"b\": 2, \"c\": 3}"}) {
            ExecutionException e = Assertions.assertThrows(ExecutionException.class,
                    () -> dispatcher.dispatch(ADD, args(json), "tester"), json);
            Assertions.assertEquals(ExecutionException.Kind.ARG_VALIDATION, e.getKind());
        }

        Assertions.assertTrue(store.find(ADD.id()).isEmpty());
        Assertions.assertEquals(WorkflowStatus.UNRAN, store.recordOrUnran(ADD.id()).status());
        Assertions.assertEquals(0, channel.backlog());
    }

    @Test
    void menuNodesCannotExecute() {
        MenuNode menu = new MenuNode("system", "System", "", Map.of());

        ExecutionException e = Assertions.assertThrows(ExecutionException.class,
                () -> dispatcher.dispatch(menu, null, "tester"));

        Assertions.assertEquals(ExecutionException.Kind.CALLABLE_REQUIRED, e.getKind());
        Assertions.assertTrue(store.find("system").isEmpty());
    }

    @Test
    void timeoutIsRecordedAsFailure() throws Exception {
        ExecutionException e = Assertions.assertThrows(ExecutionException.class,
                () -> dispatcher.dispatch(SLEEP, args("{\"ms\": 5000}"), "tester"));

        Assertions.assertEquals(ExecutionException.Kind.TIMEOUT, e.getKind());
        Assertions.assertEquals(1L, store.recordOrUnran(SLEEP.id()).failureCount());
        Assertions.assertEquals(WorkflowStatus.QUARANTINE, store.recordOrUnran(SLEEP.id()).status());
    }

    @Test
    void asyncBindingIsAwaited() throws Exception {
        ExecutionOutcome outcome = dispatcher.dispatch(ASYNC_SLEEP, args("{\"ms\": 10}"), "tester");

        Assertions.assertEquals(10L, outcome.result().path("slept_ms").asLong());
    }

    @Test
    void failingCallableCountsFailure() throws Exception {
        ExecutionException e = Assertions.assertThrows(ExecutionException.class,
                () -> dispatcher.dispatch(FAIL, args("{\"message\": \"boom\"}"), "tester"));

        Assertions.assertEquals(ExecutionException.Kind.CALLABLE_FAILURE, e.getKind());
        Assertions.assertTrue(e.getMessage().contains("boom"));
        Assertions.assertEquals(1L, store.recordOrUnran(FAIL.id()).failureCount());
        Assertions.assertEquals(1L, store.recordOrUnran(FAIL.id()).executionCount());
    }

    @Test
    void missingFunctionIsAFailure() {
        ExecutionException e = Assertions.assertThrows(ExecutionException.class,
                () -> dispatcher.dispatch(UNBOUND, null, "tester"));

        Assertions.assertEquals(ExecutionException.Kind.CALLABLE_FAILURE, e.getKind());
        Assertions.assertEquals(1L, store.recordOrUnran(UNBOUND.id()).failureCount());
    }
}
