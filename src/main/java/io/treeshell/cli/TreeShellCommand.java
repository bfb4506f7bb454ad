package io.treeshell.cli;

import io.treeshell.config.TreeShellConfig;
import io.treeshell.nav.NavConflictException;
import io.treeshell.runtime.TreeShellRuntime;
import io.treeshell.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
        name = "treeshell",
        mixinStandardHelpOptions = true,
        description = "TreeShell command-dispatch shell",
        subcommands = {
                TreeShellCommand.InitCommand.class,
                TreeShellCommand.ValidateCommand.class,
                TreeShellCommand.JumpCommand.class,
                TreeShellCommand.ChainCommand.class,
                TreeShellCommand.NavCommand.class,
                TreeShellCommand.ShortcutCommand.class,
                TreeShellCommand.ShortcutsCommand.class,
                TreeShellCommand.FollowCommand.class,
                TreeShellCommand.ApproveCommand.class,
                TreeShellCommand.RevokeCommand.class,
                TreeShellCommand.PendingCommand.class,
                TreeShellCommand.RecordsCommand.class,
                TreeShellCommand.RecordCommand.class,
                TreeShellCommand.FlaggedCommand.class,
                TreeShellCommand.WarningsCommand.class,
                TreeShellCommand.AuditVerifyCommand.class,
                TreeShellCommand.ReplCommand.class
        }
)
public final class TreeShellCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--system-config"}, description = "System layer directory (default <root>/system)")
    String systemConfig;

    @Option(names = {"--user-config"}, description = "User layer directory (default <root>/user)")
    String userConfig;

    @Option(names = {"--actor"}, description = "Actor recorded for executions and approvals")
    String actor;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | validate | jump | chain | nav | shortcut | shortcuts | follow | approve | revoke | pending | records | record | flagged | warnings | audit-verify | repl");
    }

    TreeShellConfig config() {
        return TreeShellConfig.fromRoot(root, systemConfig, userConfig);
    }

    String actor() {
        if (actor != null && !actor.isBlank()) {
            return actor.trim();
        }
        String user = System.getenv("USER");
        return user == null || user.isBlank() ? "local" : user;
    }

    /**
     * Opens a runtime for one command, prints the command's JSON and returns its exit code.
     */
    int run(Function<ShellCommandProcessor, ShellCommandProcessor.CommandResult> body) {
        TreeShellRuntime runtime;
        try {
            runtime = TreeShellRuntime.open(config());
        } catch (NavConflictException e) {
            ShellCommandProcessor.CommandResult rejected = ShellCommandProcessor.failure(e);
            System.out.println(Jsons.toJson(rejected.payload()));
            return rejected.exitCode();
        }
        try (runtime) {
            ShellCommandProcessor.CommandResult result = body.apply(new ShellCommandProcessor(runtime, actor()));
            System.out.println(Jsons.toJson(result.payload()));
            return result.exitCode();
        }
    }

    @Command(name = "init", description = "Install the system library and the workflow schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Option(names = {"--overwrite"}, description = "Replace system files that already exist")
        boolean overwrite;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(TreeShellRuntime.init(parent.config(), overwrite)));
            return 0;
        }
    }

    @Command(name = "validate", description = "Load and merge all layers without activating them")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Override
        public Integer call() {
            TreeShellRuntime.ValidateOutcome outcome = TreeShellRuntime.validate(parent.config());
            System.out.println(Jsons.toJson(outcome));
            return outcome.ok() ? 0 : ShellCommandProcessor.EXIT_CONFIG_REJECTED;
        }
    }

    @Command(name = "jump", description = "Resolve an address and show its menu, its review or execute it")
    static final class JumpCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Parameters(index = "0", description = "Numeric, semantic, bare-name, zone or alias address")
        String address;

        @Parameters(index = "1", arity = "0..1", description = "Arguments as a JSON object")
        String args;

        @Override
        public Integer call() {
            return parent.run(p -> p.jump(address, args));
        }
    }

    @Command(name = "chain", description = "Execute callables in sequence: addr [args] -> addr [args]")
    static final class ChainCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Parameters(arity = "1..*", description = "Chain expression or chain shortcut")
        List<String> expression;

        @Override
        public Integer call() {
            return parent.run(p -> p.chain(String.join(" ", expression)));
        }
    }

    @Command(name = "follow", description = "Replay a pathway saved from a REPL session")
    static final class FollowCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Parameters(index = "0", description = "Pathway name")
        String name;

        @Override
        public Integer call() {
            return parent.run(p -> p.follow(name));
        }
    }

    @Command(name = "nav", description = "Show the nav tree, or the subtree of a family, zone or node")
    static final class NavCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Family, zone or address")
        String scope;

        @Override
        public Integer call() {
            return parent.run(p -> p.nav(scope));
        }
    }

    @Command(name = "shortcut", description = "Register a jump or chain alias in the user layer")
    static final class ShortcutCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Parameters(index = "0", description = "Alias")
        String alias;

        @Parameters(index = "1..*", arity = "1..*", description = "Target address or chain expression")
        List<String> target;

        @Override
        public Integer call() {
            return parent.run(p -> p.shortcut(alias, String.join(" ", target)));
        }
    }

    @Command(name = "shortcuts", description = "List active shortcuts")
    static final class ShortcutsCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Override
        public Integer call() {
            return parent.run(ShellCommandProcessor::shortcuts);
        }
    }

    @Command(name = "approve", description = "Promote a quarantined path to golden")
    static final class ApproveCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Parameters(index = "0", description = "Node path or address")
        String path;

        @Override
        public Integer call() {
            return parent.run(p -> p.approve(path));
        }
    }

    @Command(name = "revoke", description = "Return a golden path to quarantine")
    static final class RevokeCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Parameters(index = "0", description = "Node path or address")
        String path;

        @Override
        public Integer call() {
            return parent.run(p -> p.revoke(path));
        }
    }

    @Command(name = "pending", description = "List paths awaiting approval, oldest first")
    static final class PendingCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Override
        public Integer call() {
            return parent.run(ShellCommandProcessor::pending);
        }
    }

    @Command(name = "records", description = "List workflow records")
    static final class RecordsCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Override
        public Integer call() {
            return parent.run(ShellCommandProcessor::records);
        }
    }

    @Command(name = "record", description = "Show the workflow record of one path")
    static final class RecordCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Parameters(index = "0", description = "Node path or address")
        String path;

        @Override
        public Integer call() {
            return parent.run(p -> p.record(path));
        }
    }

    @Command(name = "flagged", description = "List golden paths flagged for review")
    static final class FlaggedCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Override
        public Integer call() {
            return parent.run(ShellCommandProcessor::flagged);
        }
    }

    @Command(name = "warnings", description = "List validation warnings of the active configuration")
    static final class WarningsCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Override
        public Integer call() {
            return parent.run(ShellCommandProcessor::warnings);
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Override
        public Integer call() {
            return parent.run(ShellCommandProcessor::verifyAudit);
        }
    }

    @Command(name = "repl", description = "Interactive shell reading commands from stdin")
    static final class ReplCommand implements Callable<Integer> {
        @ParentCommand
        TreeShellCommand parent;

        @Override
        public Integer call() throws IOException {
            TreeShellRuntime runtime;
            try {
                runtime = TreeShellRuntime.open(parent.config());
            } catch (NavConflictException e) {
                ShellCommandProcessor.CommandResult rejected = ShellCommandProcessor.failure(e);
                System.out.println(Jsons.toJson(rejected.payload()));
                return rejected.exitCode();
            }
            try (runtime) {
                ShellCommandProcessor processor = new ShellCommandProcessor(runtime, parent.actor());
                BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                System.out.println(Jsons.toJson(processor.menu().payload()));
                while (true) {
                    String position = processor.position();
                    System.out.print("treeshell" + (position == null ? "" : ":" + position) + "> ");
                    System.out.flush();
                    String line = in.readLine();
                    if (line == null) {
                        return 0;
                    }
                    ShellCommandProcessor.CommandResult result = processor.execute(line);
                    System.out.println(Jsons.toJson(result.payload()));
                    if (result.exit()) {
                        return 0;
                    }
                }
            }
        }
    }
}
