package io.treeshell.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.exec.ChainExpression;
import io.treeshell.exec.ExecutionException;
import io.treeshell.exec.VariableSubstitution;
import io.treeshell.model.Node;
import io.treeshell.model.Shortcut;
import io.treeshell.nav.NavConflictException;
import io.treeshell.observability.AuditLogger;
import io.treeshell.resolve.AddressResolutionException;
import io.treeshell.runtime.MenuRenderer;
import io.treeshell.runtime.TreeShellRuntime;
import io.treeshell.workflow.ApprovalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Textual command surface shared by the CLI subcommands and the REPL. Keeps the REPL's
 * navigation stack; every command returns a {@link CommandResult} and never throws for
 * resolution, execution or approval errors.
 */
public final class ShellCommandProcessor {
    private static final Logger log = LoggerFactory.getLogger(ShellCommandProcessor.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_COMMAND_ERROR = 1;
    public static final int EXIT_CONFIG_REJECTED = 2;

    private final TreeShellRuntime runtime;
    private final String actor;
    private final Deque<String> positions = new ArrayDeque<>();
    private final ShellSession session = new ShellSession();

    public ShellCommandProcessor(TreeShellRuntime runtime, String actor) {
        this.runtime = runtime;
        this.actor = actor;
    }

    public CommandResult execute(String line) {
        List<String> tokens = CommandLineParser.parseTokens(line);
        if (tokens.isEmpty()) {
            return menu();
        }
        String op = tokens.get(0).toLowerCase(Locale.ROOT);
        if (CommandLineParser.isWriteCommand(op)) {
            log.info("Command from {}: {}", actor, op);
        }
        return switch (op) {
            case "jump" -> tokens.size() < 2
                    ? usage("jump <address> [argsJson]")
                    : jump(tokens.get(1), CommandLineParser.rawTail(line, 2));
            case "chain" -> chain(CommandLineParser.rawTail(line, 1));
            case "nav" -> nav(tokens.size() < 2 ? null : tokens.get(1));
            case "shortcut" -> tokens.size() < 3
                    ? usage("shortcut <alias> <target>")
                    : shortcut(tokens.get(1), CommandLineParser.rawTail(line, 2));
            case "shortcuts" -> shortcuts();
            case "approve" -> tokens.size() < 2 ? usage("approve <path>") : approve(tokens.get(1));
            case "revoke" -> tokens.size() < 2 ? usage("revoke <path>") : revoke(tokens.get(1));
            case "pending" -> pending();
            case "records" -> records();
            case "record" -> tokens.size() < 2 ? usage("record <path>") : record(tokens.get(1));
            case "flagged" -> flagged();
            case "warnings" -> warnings();
            case "reload" -> reload();
            case "set" -> tokens.size() < 2 ? usage("set <name> <json>") : set(tokens.get(1), CommandLineParser.rawTail(line, 2));
            case "get" -> tokens.size() < 2 ? usage("get <name>") : get(tokens.get(1));
            case "vars" -> CommandResult.ok(session.variables());
            case "history" -> CommandResult.ok(session.history());
            case "save_pathway" -> tokens.size() < 2
                    ? usage("save_pathway <name> [steps]")
                    : savePathway(tokens.get(1), CommandLineParser.rawTail(line, 2));
            case "follow" -> tokens.size() < 2 ? usage("follow <name>") : follow(tokens.get(1));
            case "back" -> back();
            case "menu" -> menu();
            case "help" -> CommandResult.ok(Map.of("commands", List.of(
                    "jump <address> [argsJson]", "chain <addr> [args] -> <addr> [args]", "nav [scope]",
                    "shortcut <alias> <target>", "shortcuts", "approve <path>", "revoke <path>", "pending",
                    "records", "record <path>", "flagged", "warnings", "reload", "set <name> <json>", "get <name>",
                    "vars", "history", "save_pathway <name> [steps]", "follow <name>", "back", "menu", "exit")));
            case "exit", "quit" -> CommandResult.bye();
            default -> select(tokens.get(0), CommandLineParser.rawTail(line, 1));
        };
    }

    public CommandResult jump(String address, String argsText) {
        return guarded(() -> {
            ObjectNode args = ChainExpression.parseArgs(address, argsText);
            TreeShellRuntime.JumpOutcome outcome = runtime.jump(address, args, actor, session.variables());
            if (outcome.execution() != null) {
                session.recordExecution(outcome.execution().nodeId(),
                        VariableSubstitution.apply(args, session.variables()), outcome.execution().result());
            }
            remember(outcome.chain());
            if (outcome.menu() != null && !outcome.nodeId().equals(positions.peek())) {
                positions.push(outcome.nodeId());
            }
            if (outcome.chain() != null && !outcome.chain().succeeded()) {
                return new CommandResult(EXIT_COMMAND_ERROR, outcome, false);
            }
            return CommandResult.ok(outcome);
        });
    }

    public CommandResult chain(String expression) {
        return guarded(() -> {
            TreeShellRuntime.ChainOutcome outcome = runtime.chain(expression, actor, session.variables());
            remember(outcome);
            return new CommandResult(outcome.succeeded() ? EXIT_OK : EXIT_COMMAND_ERROR, outcome, false);
        });
    }

    public CommandResult set(String name, String valueText) {
        return guarded(() -> CommandResult.ok(Map.of("variable", name, "value", session.set(name, valueText))));
    }

    public CommandResult get(String name) {
        return guarded(() -> CommandResult.ok(Map.of("variable", name, "value", session.get(name))));
    }

    /**
     * Saves the selected history steps as a chain shortcut named {@code name}.
     */
    public CommandResult savePathway(String name, String selection) {
        return guarded(() -> CommandResult.ok(
                runtime.registerShortcut(name, Shortcut.Type.CHAIN, session.pathway(selection),
                        "pathway saved from session history", actor)));
    }

    /**
     * Replays a chain shortcut, typically one saved with {@link #savePathway}.
     */
    public CommandResult follow(String name) {
        return guarded(() -> {
            Shortcut shortcut = runtime.snapshot().config().shortcuts().get(name);
            if (shortcut == null || shortcut.type() != Shortcut.Type.CHAIN) {
                throw new IllegalArgumentException("no saved pathway named '" + name + "'");
            }
            TreeShellRuntime.ChainOutcome outcome = runtime.chain(name, actor, session.variables());
            remember(outcome);
            return new CommandResult(outcome.succeeded() ? EXIT_OK : EXIT_COMMAND_ERROR, outcome, false);
        });
    }

    private void remember(TreeShellRuntime.ChainOutcome chain) {
        if (chain == null) {
            return;
        }
        for (TreeShellRuntime.ChainStepOutcome step : chain.steps()) {
            session.recordExecution(step.nodeId(), step.args(), step.result());
        }
    }

    public CommandResult nav(String scope) {
        return guarded(() -> CommandResult.ok(runtime.nav(scope)));
    }

    public CommandResult shortcut(String alias, String target) {
        return guarded(() -> CommandResult.ok(runtime.registerShortcut(alias, target, null, actor)));
    }

    public CommandResult shortcuts() {
        return guarded(() -> CommandResult.ok(runtime.shortcuts()));
    }

    public CommandResult approve(String path) {
        return guarded(() -> CommandResult.ok(runtime.approve(path, actor)));
    }

    public CommandResult revoke(String path) {
        return guarded(() -> CommandResult.ok(runtime.revoke(path, actor)));
    }

    public CommandResult pending() {
        return guarded(() -> CommandResult.ok(runtime.pending()));
    }

    public CommandResult records() {
        return guarded(() -> CommandResult.ok(runtime.records()));
    }

    public CommandResult record(String path) {
        return guarded(() -> CommandResult.ok(runtime.record(path)));
    }

    public CommandResult flagged() {
        return guarded(() -> CommandResult.ok(runtime.flagged()));
    }

    public CommandResult warnings() {
        return guarded(() -> CommandResult.ok(runtime.warnings()));
    }

    public CommandResult verifyAudit() {
        AuditLogger.IntegrityReport report = runtime.verifyAudit();
        return new CommandResult(report.ok() ? EXIT_OK : EXIT_COMMAND_ERROR, report, false);
    }

    public CommandResult reload() {
        return guarded(() -> {
            TreeShellRuntime.ReloadOutcome outcome = runtime.reload();
            return new CommandResult(outcome.applied() ? EXIT_OK : EXIT_CONFIG_REJECTED, outcome, false);
        });
    }

    /**
     * Current position of the REPL, or {@code null} at the top level.
     */
    public String position() {
        return positions.peek();
    }

    CommandResult back() {
        positions.poll();
        return menu();
    }

    CommandResult menu() {
        String current = positions.peek();
        if (current == null) {
            return nav(null);
        }
        Optional<Node> node = runtime.snapshot().nodes().find(current);
        if (node.isEmpty()) {
            // dropped by a reload
            positions.clear();
            return nav(null);
        }
        return CommandResult.ok(MenuRenderer.menu(runtime.snapshot(), node.get()));
    }

    /**
     * Option selector or universal selector typed at the current position, optionally followed
     * by further selectors; anything else is a global address.
     */
    private CommandResult select(String selector, String argsText) {
        String current = positions.peek();
        if (current == null) {
            return jump(selector, argsText);
        }
        int dot = selector.indexOf('.');
        String head = dot < 0 ? selector : selector.substring(0, dot);
        String rest = dot < 0 ? "" : selector.substring(dot);
        Optional<Node> node = runtime.snapshot().nodes().find(current);
        if (node.isPresent() && node.get().options().containsKey(head)) {
            return jump(node.get().options().get(head) + rest, argsText);
        }
        if (Node.isUniversalSelector(head)) {
            return jump(current + "." + selector, argsText);
        }
        return jump(selector, argsText);
    }

    private CommandResult usage(String text) {
        return CommandResult.error(EXIT_COMMAND_ERROR, new ErrorPayload("USAGE", "usage: " + text, null));
    }

    private static CommandResult guarded(CommandBody body) {
        try {
            return body.run();
        } catch (RuntimeException e) {
            return failure(e);
        }
    }

    /**
     * Maps command-level exceptions to an error payload and exit code; anything else is an
     * infrastructure failure and propagates.
     */
    static CommandResult failure(RuntimeException e) {
        if (e instanceof AddressResolutionException) {
            AddressResolutionException are = (AddressResolutionException) e;
            List<String> candidates = are.getCandidates().isEmpty() ? null : are.getCandidates();
            return CommandResult.error(EXIT_COMMAND_ERROR, new ErrorPayload(are.getKind().name(), e.getMessage(), candidates));
        }
        if (e instanceof ExecutionException) {
            return CommandResult.error(EXIT_COMMAND_ERROR,
                    new ErrorPayload(((ExecutionException) e).getKind().name(), e.getMessage(), null));
        }
        if (e instanceof ApprovalException) {
            return CommandResult.error(EXIT_COMMAND_ERROR,
                    new ErrorPayload(((ApprovalException) e).getKind().name(), e.getMessage(), null));
        }
        if (e instanceof NavConflictException) {
            return CommandResult.error(EXIT_CONFIG_REJECTED,
                    new ErrorPayload("NAV_CONFLICT", e.getMessage(), ((NavConflictException) e).conflicts()));
        }
        if (e instanceof IllegalArgumentException) {
            return CommandResult.error(EXIT_COMMAND_ERROR, new ErrorPayload("INVALID_ARGUMENT", e.getMessage(), null));
        }
        throw e;
    }

    @FunctionalInterface
    private interface CommandBody {
        CommandResult run();
    }

    public record CommandResult(int exitCode, Object payload, boolean exit) {
        static CommandResult ok(Object payload) {
            return new CommandResult(EXIT_OK, payload, false);
        }

        static CommandResult error(int exitCode, ErrorPayload payload) {
            return new CommandResult(exitCode, payload, false);
        }

        static CommandResult bye() {
            return new CommandResult(EXIT_OK, Map.of("bye", true), true);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorPayload(String error, String message, List<String> details) {
    }
}
