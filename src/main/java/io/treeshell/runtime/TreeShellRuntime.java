package io.treeshell.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.config.ConfigKind;
import io.treeshell.config.ShellSettings;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.exec.CallableRegistry;
import io.treeshell.exec.ChainExpression;
import io.treeshell.exec.ExecutionDispatcher;
import io.treeshell.exec.ExecutionException;
import io.treeshell.exec.ExecutionOutcome;
import io.treeshell.exec.VariableSubstitution;
import io.treeshell.load.InvalidEntryException;
import io.treeshell.merge.Customization;
import io.treeshell.merge.ShortcutValidator;
import io.treeshell.model.Binding;
import io.treeshell.model.CallableNode;
import io.treeshell.model.Node;
import io.treeshell.model.Shortcut;
import io.treeshell.model.ValidationWarning;
import io.treeshell.model.WorkflowRecord;
import io.treeshell.nav.NavConflictException;
import io.treeshell.observability.AuditLogger;
import io.treeshell.observability.SensitiveDataMasker;
import io.treeshell.resolve.AddressResolutionException;
import io.treeshell.resolve.MatchRule;
import io.treeshell.resolve.ResolvedAddress;
import io.treeshell.storage.Database;
import io.treeshell.storage.WorkflowStore;
import io.treeshell.util.Jsons;
import io.treeshell.workflow.ApprovalChannel;
import io.treeshell.workflow.ApprovalOutcome;
import io.treeshell.workflow.ApprovalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Coordinator composing the loader, merge engine, resolver, dispatcher and workflow tracker.
 * The active {@link ShellSnapshot} is swapped atomically on reload; a rejected reload keeps the
 * previous one.
 */
public final class TreeShellRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TreeShellRuntime.class);

    private final TreeShellConfig config;
    private final ShellSettings settings;
    private final SnapshotBuilder snapshotBuilder;
    private final AtomicReference<ShellSnapshot> active = new AtomicReference<>();
    private final Database database;
    private final WorkflowStore workflowStore;
    private final AuditLogger auditLogger;
    private final CallableRegistry callables;
    private final ApprovalService approvals;
    private final ExecutionDispatcher dispatcher;
    private final Object shortcutWriteLock = new Object();

    private TreeShellRuntime(TreeShellConfig config, ShellSettings settings, ShellSnapshot initial) {
        this.config = config;
        this.settings = settings;
        this.snapshotBuilder = new SnapshotBuilder();
        this.active.set(initial);
        this.database = new Database(config);
        this.database.init();
        this.workflowStore = new WorkflowStore(database);
        this.auditLogger = new AuditLogger(config.auditFile());
        this.callables = CallableRegistry.withDefaults(settings);
        ApprovalChannel channel = new ApprovalChannel();
        this.approvals = new ApprovalService(workflowStore, channel, event -> auditLogger.log(AuditLogger.AuditEvent.of(
                "workflow." + event.action(),
                event.actor(),
                event.path(),
                event.status().name(),
                Map.of()
        ))).start();
        this.dispatcher = new ExecutionDispatcher(callables, workflowStore, channel,
                settings.callableTimeoutMs(), settings.goldenFailureThreshold());
    }

    /**
     * Loads settings, builds the first snapshot and opens the workflow database.
     *
     * @throws NavConflictException when the nav configuration is rejected
     */
    public static TreeShellRuntime open(TreeShellConfig config) {
        ShellSettings settings = ShellSettings.load(config.settingsFile());
        ShellSnapshot initial = new SnapshotBuilder().build(config, settings, 1L);
        log.info("TreeShell runtime opened at {} with {} nodes", config.rootDir(), initial.nodes().size());
        return new TreeShellRuntime(config, settings, initial);
    }

    /**
     * Installs the bundled system library and the workflow schema without building a snapshot.
     */
    public static InitOutcome init(TreeShellConfig config, boolean overwrite) {
        List<String> installed = StarterLibrary.install(config, overwrite);
        Database database = new Database(config);
        database.init();
        return new InitOutcome(config.rootDir().toString(), config.systemDir().toString(),
                config.userDir().toString(), installed, database.schemaVersion());
    }

    /**
     * Builds a snapshot without activating it and reports what a reload would see.
     */
    public static ValidateOutcome validate(TreeShellConfig config) {
        ShellSettings settings = ShellSettings.load(config.settingsFile());
        try {
            ShellSnapshot snapshot = new SnapshotBuilder().build(config, settings, 0L);
            return new ValidateOutcome(true, snapshot.config().families().size(), snapshot.nodes().size(),
                    snapshot.warnings(), List.of());
        } catch (NavConflictException e) {
            return new ValidateOutcome(false, 0, 0, List.of(), e.conflicts());
        }
    }

    public ShellSnapshot snapshot() {
        return active.get();
    }

    public ShellSettings settings() {
        return settings;
    }

    public CallableRegistry callables() {
        return callables;
    }

    public ReloadOutcome reload() {
        ShellSnapshot current = active.get();
        try {
            ShellSnapshot next = snapshotBuilder.build(config, settings, current.generation() + 1);
            active.set(next);
            auditLogger.log(AuditLogger.AuditEvent.of("config.reload", "runtime", "snapshot", "applied",
                    Map.of("generation", next.generation(), "nodes", next.nodes().size(), "warnings", next.warnings().size())));
            return new ReloadOutcome(true, next.generation(), next.nodes().size(), next.warnings().size(), List.of());
        } catch (NavConflictException e) {
            log.warn("Reload rejected, keeping generation {}: {}", current.generation(), e.getMessage());
            auditLogger.log(AuditLogger.AuditEvent.of("config.reload", "runtime", "snapshot", "rejected",
                    Map.of("conflicts", e.conflicts())));
            return new ReloadOutcome(false, current.generation(), current.nodes().size(), current.warnings().size(), e.conflicts());
        }
    }

    public ResolvedAddress resolve(String address) {
        return snapshot().resolver().resolve(address);
    }

    /**
     * Resolves and then renders the menu view, renders the argument review, or executes,
     * depending on the view the address selects. A chain shortcut runs its chain.
     */
    public JumpOutcome jump(String address, ObjectNode args, String actor) {
        return jump(address, args, actor, Map.of());
    }

    /**
     * As {@link #jump(String, ObjectNode, String)}, with session variables substituted into the
     * arguments of an execution and made available to a chain shortcut.
     */
    public JumpOutcome jump(String address, ObjectNode args, String actor, Map<String, JsonNode> session) {
        ShellSnapshot snap = snapshot();
        String token = address == null ? "" : address.trim();
        Shortcut shortcut = snap.config().shortcuts().get(token);
        if (shortcut != null && shortcut.type() == Shortcut.Type.CHAIN) {
            ChainOutcome chain = runChain(snap, shortcut.target(), actor, session);
            return new JumpOutcome(token, null, null, null, MatchRule.ALIAS.name(), null, null, null, null, chain);
        }
        ResolvedAddress resolved = snap.resolver().resolve(token);
        Node node = resolved.node();
        return switch (resolved.view()) {
            case MENU -> jumpOutcome(token, resolved, MenuRenderer.menu(snap, node), null, null);
            case ACTION -> jumpOutcome(token, resolved, null, MenuRenderer.review(requireCallable(node)), null);
            case EXECUTE -> jumpOutcome(token, resolved, null, null,
                    execute(node, args == null ? null : VariableSubstitution.apply(args, session), actor));
        };
    }

    public ChainOutcome chain(String expression, String actor) {
        return chain(expression, actor, Map.of());
    }

    public ChainOutcome chain(String expression, String actor, Map<String, JsonNode> session) {
        ShellSnapshot snap = snapshot();
        String text = expression == null ? "" : expression.trim();
        Shortcut shortcut = snap.config().shortcuts().get(text);
        if (shortcut != null && shortcut.type() == Shortcut.Type.CHAIN) {
            text = shortcut.target();
        }
        return runChain(snap, text, actor, session);
    }

    /**
     * Session variables seed the step variables; step results shadow a session variable of the
     * same name for the rest of the chain.
     */
    private ChainOutcome runChain(ShellSnapshot snap, String expression, String actor, Map<String, JsonNode> session) {
        List<ChainExpression.Step> steps = ChainExpression.parse(expression);
        if (steps.size() > settings.maxChainSteps()) {
            throw new ExecutionException(ExecutionException.Kind.ARG_VALIDATION,
                    "chain has " + steps.size() + " steps; the limit is " + settings.maxChainSteps());
        }
        Map<String, JsonNode> variables = new LinkedHashMap<>(session);
        List<ChainStepOutcome> completed = new ArrayList<>();
        for (ChainExpression.Step step : steps) {
            try {
                ResolvedAddress resolved = snap.resolver().resolve(step.address());
                ObjectNode args = VariableSubstitution.apply(
                        ChainExpression.parseArgs(step.address(), step.argsText()), variables);
                ExecutionOutcome outcome = execute(resolved.node(), args, actor);
                variables.put(VariableSubstitution.stepVariable(step.index()), outcome.result());
                variables.put(VariableSubstitution.LAST_RESULT, outcome.result());
                completed.add(new ChainStepOutcome(step.index(), step.address(), outcome.nodeId(), args,
                        outcome.result(), outcome.durationMs()));
            } catch (AddressResolutionException e) {
                return chainFailure(expression, completed, step, e.getKind().name(), e.getMessage());
            } catch (ExecutionException e) {
                return chainFailure(expression, completed, step, e.getKind().name(), e.getMessage());
            }
        }
        return new ChainOutcome(expression, completed, lastResult(completed), null, null, null);
    }

    private ChainOutcome chainFailure(String expression, List<ChainStepOutcome> completed,
                                      ChainExpression.Step step, String kind, String message) {
        log.warn("Chain stopped at step {} ({}): {}", step.index(), step.address(), message);
        return new ChainOutcome(expression, completed, lastResult(completed), step.index(), kind, message);
    }

    private static JsonNode lastResult(List<ChainStepOutcome> completed) {
        return completed.isEmpty() ? null : completed.get(completed.size() - 1).result();
    }

    private ExecutionOutcome execute(Node node, ObjectNode args, String actor) {
        Map<String, Object> details = new LinkedHashMap<>();
        Binding binding = node instanceof CallableNode ? ((CallableNode) node).binding() : null;
        details.put("args", SensitiveDataMasker.maskArgs(binding, args));
        try {
            ExecutionOutcome outcome = dispatcher.dispatch(node, args, actor);
            details.put("duration_ms", outcome.durationMs());
            details.put("status", outcome.record().status().name());
            auditLogger.log(AuditLogger.AuditEvent.of("node.execute", actor, node.id(), "ok", details));
            return outcome;
        } catch (ExecutionException e) {
            if (e.getKind() != ExecutionException.Kind.ARG_VALIDATION
                    && e.getKind() != ExecutionException.Kind.CALLABLE_REQUIRED) {
                details.put("error", e.getMessage());
                auditLogger.log(AuditLogger.AuditEvent.of("node.execute", actor, node.id(), e.getKind().name(), details));
            }
            throw e;
        }
    }

    private static CallableNode requireCallable(Node node) {
        if (!(node instanceof CallableNode)) {
            throw new ExecutionException(ExecutionException.Kind.CALLABLE_REQUIRED,
                    node.id() + " is a menu; selector 1 applies to callable nodes only");
        }
        return (CallableNode) node;
    }

    private static JumpOutcome jumpOutcome(String address, ResolvedAddress resolved, MenuRenderer.MenuView menu,
                                           MenuRenderer.ReviewView review, ExecutionOutcome execution) {
        return new JumpOutcome(address, resolved.nodeId(), resolved.typedAddress(), resolved.canonicalAddress(),
                resolved.rule().name(), resolved.view().name(), menu, review, execution, null);
    }

    /**
     * Renders the whole nav tree, or the subtree of a family, zone or resolvable address.
     */
    public MenuRenderer.NavView nav(String scope) {
        ShellSnapshot snap = snapshot();
        if (scope == null || scope.isBlank()) {
            return MenuRenderer.navAll(snap);
        }
        String token = scope.trim();
        if (snap.config().families().containsKey(token) && snap.nodes().contains(token)) {
            return MenuRenderer.navFrom(snap, "family", token, snap.nodes().find(token).orElseThrow());
        }
        if (snap.zones().hasZone(token)) {
            return MenuRenderer.navZone(snap, token);
        }
        return MenuRenderer.navFrom(snap, "node", token, snap.resolver().resolve(token).node());
    }

    /**
     * Adds an alias to the user shortcut customization and reloads. Targets containing
     * {@code ->} register chain shortcuts.
     */
    public ShortcutOutcome registerShortcut(String alias, String target, String description, String actor) {
        String cleanTarget = target == null ? "" : target.trim();
        Shortcut.Type type = cleanTarget.contains(ChainExpression.ARROW) ? Shortcut.Type.CHAIN : Shortcut.Type.JUMP;
        return registerShortcut(alias, type, cleanTarget, description, actor);
    }

    public ShortcutOutcome registerShortcut(String alias, Shortcut.Type type, String target, String description,
                                            String actor) {
        ShellSnapshot snap = snapshot();
        String cleanTarget = target == null ? "" : target.trim();
        Shortcut shortcut = new Shortcut(alias == null ? "" : alias.trim(), type, cleanTarget, description);
        ObjectNode definition = ShortcutValidator.toTree(shortcut);
        try {
            new ShortcutValidator().validate(shortcut.alias(), definition, note -> log.warn("Shortcut {}: {}", shortcut.alias(), note));
        } catch (InvalidEntryException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        if (type == Shortcut.Type.JUMP) {
            snap.resolver().resolve(cleanTarget);
        } else {
            ChainExpression.parse(cleanTarget);
        }

        synchronized (shortcutWriteLock) {
            Path file = config.customizationFile(ConfigKind.SHORTCUTS);
            Customization current = Customization.read(file, warning -> log.warn("Existing shortcut customization: {}", warning));
            writeCustomization(file, current.withAddition(shortcut.alias(), definition));
        }
        ReloadOutcome reload = reload();
        boolean shadowed = isShadowed(shortcut.alias());
        auditLogger.log(AuditLogger.AuditEvent.of("shortcut.register", actor, shortcut.alias(), "ok",
                Map.of("type", type.name(), "target", cleanTarget, "shadowed", shadowed)));
        return new ShortcutOutcome(shortcut.alias(), type.name(), cleanTarget, shadowed, reload.applied(), reload.generation());
    }

    private boolean isShadowed(String alias) {
        try {
            return snapshot().resolver().resolve(alias).rule() != MatchRule.ALIAS;
        } catch (AddressResolutionException e) {
            return e.getKind() == AddressResolutionException.Kind.AMBIGUOUS;
        }
    }

    private static void writeCustomization(Path file, Customization customization) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toJson(customization.toTree()), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write customization file: " + file, e);
        }
    }

    public List<Shortcut> shortcuts() {
        return List.copyOf(snapshot().config().shortcuts().values());
    }

    public ApprovalOutcome approve(String address, String actor) {
        return approvals.approve(workflowPath(address), actor);
    }

    public ApprovalOutcome revoke(String address, String actor) {
        return approvals.revoke(workflowPath(address), actor);
    }

    public WorkflowRecord record(String address) {
        return workflowStore.recordOrUnran(workflowPath(address));
    }

    public List<WorkflowRecord> records() {
        return workflowStore.listRecords();
    }

    public List<WorkflowStore.PendingApproval> pending() {
        return workflowStore.listPending();
    }

    public List<WorkflowRecord> flagged() {
        return workflowStore.listFlagged();
    }

    public List<ValidationWarning> warnings() {
        return snapshot().warnings();
    }

    public AuditLogger.IntegrityReport verifyAudit() {
        return auditLogger.verify();
    }

    /**
     * Canonical record path for an address. Records outlive nodes, so a path that no longer
     * resolves is still accepted when a record exists for it.
     */
    private String workflowPath(String address) {
        String token = address == null ? "" : address.trim();
        try {
            return resolve(token).nodeId();
        } catch (AddressResolutionException e) {
            if (e.getKind() == AddressResolutionException.Kind.NOT_FOUND && workflowStore.find(token).isPresent()) {
                return token;
            }
            throw e;
        }
    }

    @Override
    public void close() {
        dispatcher.close();
        approvals.close();
    }

    public record InitOutcome(String root, String systemDir, String userDir, List<String> installed, String schemaVersion) {
    }

    public record ValidateOutcome(boolean ok, int families, int nodes, List<ValidationWarning> warnings, List<String> conflicts) {
    }

    public record ReloadOutcome(boolean applied, long generation, int nodes, int warnings, List<String> conflicts) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JumpOutcome(
            String address,
            String nodeId,
            String typedAddress,
            String canonicalAddress,
            String rule,
            String view,
            MenuRenderer.MenuView menu,
            MenuRenderer.ReviewView review,
            ExecutionOutcome execution,
            ChainOutcome chain
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChainOutcome(
            String expression,
            List<ChainStepOutcome> steps,
            JsonNode lastResult,
            Integer failedStep,
            String errorKind,
            String error
    ) {
        public boolean succeeded() {
            return failedStep == null;
        }
    }

    public record ChainStepOutcome(int index, String address, String nodeId, ObjectNode args, JsonNode result,
                                   long durationMs) {
    }

    public record ShortcutOutcome(String alias, String type, String target, boolean shadowed, boolean reloaded, long generation) {
    }
}
