package io.treeshell.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.model.CallableNode;
import io.treeshell.model.Node;
import io.treeshell.storage.WorkflowStore;
import io.treeshell.util.Jsons;
import io.treeshell.workflow.ApprovalChannel;
import io.treeshell.workflow.ApprovalMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Validates arguments, invokes the bound callable with a timeout and records the outcome.
 * Argument errors are raised before the workflow record is touched; every invocation that
 * starts is recorded as exactly one success or one failure.
 */
public final class ExecutionDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final CallableRegistry registry;
    private final WorkflowStore workflowStore;
    private final ApprovalChannel approvals;
    private final long timeoutMs;
    private final int failureThreshold;
    private final ExecutorService executor;

    public ExecutionDispatcher(CallableRegistry registry, WorkflowStore workflowStore, ApprovalChannel approvals,
                               long timeoutMs, int failureThreshold) {
        this.registry = registry;
        this.workflowStore = workflowStore;
        this.approvals = approvals;
        this.timeoutMs = timeoutMs;
        this.failureThreshold = failureThreshold;
        this.executor = Executors.newCachedThreadPool(daemonThreads());
    }

    public ExecutionOutcome dispatch(Node node, ObjectNode args, String actor) {
        if (!(node instanceof CallableNode)) {
            throw new ExecutionException(ExecutionException.Kind.CALLABLE_REQUIRED,
                    node.id() + " is a menu; only callable nodes execute");
        }
        CallableNode callable = (CallableNode) node;
        ObjectNode safeArgs = args == null ? Jsons.mapper().createObjectNode() : args;
        ArgsValidator.validate(node.id(), callable.binding(), safeArgs);

        String functionName = callable.binding().functionName();
        CallableContext context = new CallableContext(node.id(), functionName, safeArgs.deepCopy(), actor);
        long started = System.nanoTime();
        CallableResult result;
        try {
            result = invoke(callable, context);
        } catch (ExecutionException e) {
            record(node.id(), false);
            throw e;
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        WorkflowStore.RecordedExecution recorded = record(node.id(), result.success());
        if (!result.success()) {
            throw new ExecutionException(ExecutionException.Kind.CALLABLE_FAILURE,
                    node.id() + " failed: " + result.error());
        }
        JsonNode output = result.output() == null ? NullNode.getInstance() : result.output();
        log.debug("Executed {} via {} in {} ms", node.id(), functionName, durationMs);
        return new ExecutionOutcome(node.id(), functionName, output, durationMs, recorded.record());
    }

    private CallableResult invoke(CallableNode node, CallableContext context) {
        ShellCallable callable = registry.findByName(context.functionName())
                .orElseThrow(() -> new ExecutionException(ExecutionException.Kind.CALLABLE_FAILURE,
                        "no callable registered for function '" + context.functionName() + "'"));
        Future<CallableResult> future = node.binding().async()
                ? callable.callAsync(context, executor)
                : executor.submit(() -> callable.call(context));
        try {
            CallableResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result == null ? CallableResult.fail("callable returned no result") : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Callable {} for {} timed out after {} ms", context.functionName(), node.id(), timeoutMs);
            throw new ExecutionException(ExecutionException.Kind.TIMEOUT,
                    node.id() + " timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutionException(ExecutionException.Kind.CANCELLED, node.id() + " was cancelled", e);
        } catch (CancellationException e) {
            throw new ExecutionException(ExecutionException.Kind.CANCELLED, node.id() + " was cancelled", e);
        } catch (java.util.concurrent.ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new ExecutionException(ExecutionException.Kind.CALLABLE_FAILURE,
                    node.id() + " raised " + cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    private WorkflowStore.RecordedExecution record(String path, boolean success) {
        WorkflowStore.RecordedExecution recorded = workflowStore.recordExecution(
                path, success, Instant.now().toEpochMilli(), failureThreshold);
        if (recorded.created()) {
            approvals.post(ApprovalMessage.quarantineNotice(path));
        }
        if (recorded.newlyFlagged()) {
            log.warn("Golden path {} flagged for review after {} failures", path, recorded.record().failureCount());
        }
        return recorded;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "treeshell-callable-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
